package org.carball.tuner.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.schema.Table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the set of known columns from {@code CREATE TABLE} statements, for tuning runs that read the
 * schema offline instead of asking a replica.
 */
@Slf4j
public class SchemaParser {

    private SchemaParser() {
        // Utility class - prevent instantiation
    }

    public static DatabaseSchema parseDDL(Path ddlFile) throws IOException {
        if (!Files.exists(ddlFile)) {
            throw new IOException("Schema file not found: " + ddlFile);
        }
        return parseDDL(Files.readString(ddlFile));
    }

    public static DatabaseSchema parseDDL(String ddlContent) {
        DatabaseSchema schema = new DatabaseSchema();

        try {
            Statements statements = CCJSqlParserUtil.parseStatements(preprocessDDL(ddlContent));

            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateTable createTable) {
                    Table table = convertTable(createTable);
                    if (schema.findTable(table.getName()).isPresent()) {
                        log.warn("Table {} declared more than once, keeping the first declaration", table.getName());
                        continue;
                    }
                    schema.addTable(table);
                    log.debug("Parsed table: {} ({} columns)", table.getName(), table.getColumns().size());
                }
            }
        } catch (JSQLParserException e) {
            log.error("Error parsing DDL: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid SQL DDL: " + e.getMessage(), e);
        }

        return schema;
    }

    private static String preprocessDDL(String ddlContent) {
        // Drop line comments and collapse whitespace; JSqlParser handles the rest of PostgreSQL DDL
        String processed = ddlContent.replaceAll("(?m)--.*$", "");
        return processed.replaceAll("\\s+", " ").trim();
    }

    private static Table convertTable(CreateTable createTable) {
        Table table = new Table(cleanIdentifier(createTable.getTable().getName()));

        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition colDef : createTable.getColumnDefinitions()) {
                String columnName = cleanIdentifier(colDef.getColumnName());
                if (table.findColumn(columnName).isEmpty()) {
                    table.addColumn(columnName);
                }
            }
        }

        return table;
    }

    private static String cleanIdentifier(String identifier) {
        if (identifier == null) return null;

        // Remove quotes and the public schema prefix
        return identifier
                .replaceAll("[\\[\\]`\"]", "")
                .replaceAll("^public\\.", "");
    }
}

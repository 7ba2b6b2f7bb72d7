package org.carball.tuner.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.replica.ReplicaEndpoint;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the replica roster, one replica per line: {@code id,host,port,dbname,user[,password]}.
 * Blank lines and lines starting with {@code #} are skipped. Roster order is replica position order.
 */
@Slf4j
public class ReplicaRosterReader {

    private ReplicaRosterReader() {
        // Utility class - prevent instantiation
    }

    public static List<ReplicaEndpoint> read(Path rosterFile) throws IOException {
        if (!Files.exists(rosterFile)) {
            throw new IOException("Replica roster not found: " + rosterFile);
        }
        List<ReplicaEndpoint> endpoints = parse(Files.readAllLines(rosterFile));
        log.info("Read {} replicas from {}", endpoints.size(), rosterFile);
        return endpoints;
    }

    public static List<ReplicaEndpoint> parse(List<String> lines) {
        List<ReplicaEndpoint> endpoints = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int lineNumber = 1; lineNumber <= lines.size(); lineNumber++) {
            String line = lines.get(lineNumber - 1).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            ReplicaEndpoint endpoint = parseLine(line, lineNumber);
            if (!ids.add(endpoint.getId())) {
                throw new IllegalArgumentException("Duplicate replica id '" + endpoint.getId() + "' on line " + lineNumber);
            }
            endpoints.add(endpoint);
        }

        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("Replica roster lists no replicas");
        }
        return endpoints;
    }

    private static ReplicaEndpoint parseLine(String line, int lineNumber) {
        String[] fields = line.split(",", -1);
        if (fields.length < 5 || fields.length > 6) {
            throw new IllegalArgumentException("Line " + lineNumber
                    + ": expected id,host,port,dbname,user[,password] but found " + fields.length + " fields");
        }

        ReplicaEndpoint.ReplicaEndpointBuilder builder = ReplicaEndpoint.builder()
                .id(required(fields[0], "id", lineNumber))
                .host(required(fields[1], "host", lineNumber))
                .database(required(fields[3], "dbname", lineNumber))
                .user(required(fields[4], "user", lineNumber));

        String port = fields[2].strip();
        if (!port.isEmpty()) {
            try {
                builder.port(Integer.parseInt(port));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Line " + lineNumber + ": invalid port '" + port + "'", e);
            }
        }
        if (fields.length == 6 && !fields[5].isEmpty()) {
            builder.password(fields[5].strip());
        }
        return builder.build();
    }

    private static String required(String value, String field, int lineNumber) {
        String trimmed = value.strip();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Line " + lineNumber + ": missing " + field);
        }
        return trimmed;
    }
}

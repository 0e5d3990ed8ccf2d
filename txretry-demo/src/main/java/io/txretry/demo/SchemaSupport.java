package io.txretry.demo;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.LineNumberReader;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import io.txretry.jdbc.TransactionTemplate;

public abstract class SchemaSupport {
    public static final String DB_CREATE_SQL = "/db/create.sql";

    private SchemaSupport() {
    }

    public static void setupSchema(TransactionTemplate template) throws IOException, SQLException {
        for (String sql : readStatements(DB_CREATE_SQL)) {
            template.execute(conn -> {
                try (Statement statement = conn.createStatement()) {
                    statement.execute(sql);
                }
                return null;
            });
        }
    }

    static List<String> readStatements(String resource) throws IOException {
        InputStream is = SchemaSupport.class.getResourceAsStream(resource);
        if (is == null) {
            throw new IOException("DDL file not found: " + resource);
        }

        List<String> statements = new ArrayList<>();

        try (LineNumberReader reader = new LineNumberReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            StringBuilder buffer = new StringBuilder();
            String line = reader.readLine();
            while (line != null) {
                line = line.trim();
                if (!line.startsWith("--") && !line.isEmpty()) {
                    buffer.append(line).append(" ");
                }
                if (line.endsWith(";") && buffer.length() > 0) {
                    statements.add(buffer.toString().trim());
                    buffer.setLength(0);
                }
                line = reader.readLine();
            }
        }

        return statements;
    }
}

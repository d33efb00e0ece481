package com.example.navireader.morph.dictionary;

import com.example.navireader.morph.MorphologyException;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SQLite copy of the dictionary, so that a downloaded or parsed word list can be reused
 * without fetching it again. Translations are stored as a JSON array.
 */
public final class SqliteLexiconStore implements LexiconLookup, LexiconSource {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
    private static final Type STRING_LIST = new TypeToken<List<String>>() { }.getType();

    private final Path databasePath;

    public SqliteLexiconStore(Path databasePath) {
        this.databasePath = Objects.requireNonNull(databasePath, "databasePath");
    }

    /**
     * Replaces the stored dictionary with {@code records}.
     *
     * @return number of rows written
     */
    public int importRecords(List<LexicalRecord> records) {
        Objects.requireNonNull(records, "records");
        try {
            Path parent = databasePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Connection connection = connect()) {
                initialiseDatabase(connection);
                connection.setAutoCommit(false);
                try {
                    try (Statement statement = connection.createStatement()) {
                        statement.executeUpdate("DELETE FROM lexicon");
                    }
                    String sql = "INSERT INTO lexicon (surface, syllabic, acoustic, pos, translations) "
                            + "VALUES (?,?,?,?,?)";
                    try (PreparedStatement statement = connection.prepareStatement(sql)) {
                        for (LexicalRecord record : records) {
                            statement.setString(1, record.surfaceForm());
                            statement.setString(2, record.syllabicForm());
                            statement.setString(3, record.acousticForm());
                            statement.setString(4, record.partOfSpeech());
                            statement.setString(5, GSON.toJson(record.translations()));
                            statement.addBatch();
                        }
                        statement.executeBatch();
                    }
                    connection.commit();
                } catch (SQLException ex) {
                    connection.rollback();
                    throw ex;
                }
            }
            return records.size();
        } catch (IOException | SQLException ex) {
            throw new MorphologyException("Failed to write dictionary to " + databasePath.toAbsolutePath(), ex);
        }
    }

    @Override
    public Optional<LexicalRecord> lookup(String lemma) {
        if (lemma == null || !Files.exists(databasePath)) {
            return Optional.empty();
        }
        String sql = "SELECT surface, syllabic, acoustic, pos, translations FROM lexicon "
                + "WHERE surface = ? COLLATE NOCASE ORDER BY id LIMIT 1";
        try (Connection connection = connect();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, lemma);
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next() ? Optional.of(toRecord(rows)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw new MorphologyException("Dictionary lookup failed for '" + lemma + "'", ex);
        }
    }

    @Override
    public List<LexicalRecord> load() {
        if (!Files.exists(databasePath)) {
            return List.of();
        }
        String sql = "SELECT surface, syllabic, acoustic, pos, translations FROM lexicon ORDER BY id";
        try (Connection connection = connect();
             Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery(sql)) {
            List<LexicalRecord> records = new ArrayList<>();
            while (rows.next()) {
                records.add(toRecord(rows));
            }
            return records;
        } catch (SQLException ex) {
            throw new MorphologyException("Failed to read dictionary from " + databasePath.toAbsolutePath(), ex);
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + databasePath.toAbsolutePath());
    }

    private static void initialiseDatabase(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS lexicon ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + "surface TEXT NOT NULL,"
                    + "syllabic TEXT NOT NULL,"
                    + "acoustic TEXT NOT NULL,"
                    + "pos TEXT NOT NULL,"
                    + "translations TEXT NOT NULL"
                    + ")");
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_lexicon_surface ON lexicon(surface COLLATE NOCASE)");
        }
    }

    private static LexicalRecord toRecord(ResultSet rows) throws SQLException {
        return new LexicalRecord(rows.getString(1), rows.getString(2), rows.getString(3), rows.getString(4),
                parseTranslations(rows.getString(5)));
    }

    private static List<String> parseTranslations(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<String> values = GSON.fromJson(json, STRING_LIST);
            return values == null ? List.of() : values;
        } catch (JsonParseException ex) {
            throw new MorphologyException("Corrupt translations column: " + json, ex);
        }
    }
}

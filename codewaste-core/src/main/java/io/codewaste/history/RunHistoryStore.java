package io.codewaste.history;

import io.codewaste.AnalysisConfig;
import io.codewaste.findings.DiagnosticReport;
import io.codewaste.findings.DiagnosticSummary;
import io.codewaste.findings.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Records diagnostic runs in a SQLite database and computes the trend against
 * the previous run of the same repository.
 *
 * <pre>{@code
 * RunHistory history = new RunHistoryStore(Path.of(".codewaste/history.db")).record(report);
 * }</pre>
 *
 * <p>Repositories are keyed by their real path, lowercased. The schema is
 * created on first use; each {@link #record} call runs in one transaction.</p>
 */
public class RunHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(RunHistoryStore.class);

    static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private static final String CREATE_RUNS = """
        CREATE TABLE IF NOT EXISTS runs (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            repo_key TEXT NOT NULL,
            repo_path TEXT NOT NULL,
            scanned_at TEXT NOT NULL,
            functions_scanned INTEGER NOT NULL,
            probable_ai_functions INTEGER NOT NULL,
            high_confidence_duplication_pairs INTEGER NOT NULL,
            runtime_zero_invocations INTEGER NOT NULL,
            probable_ai_zero_invocations INTEGER NOT NULL,
            estimated_annualized_avoidable_runtime_cost REAL NOT NULL,
            ai_threshold REAL NOT NULL,
            dup_threshold REAL NOT NULL,
            min_dup_body_statements INTEGER NOT NULL,
            min_dup_signature_chars INTEGER NOT NULL,
            include_tests INTEGER NOT NULL,
            git_provenance_enabled INTEGER NOT NULL
        )
        """;

    private static final String CREATE_FINDING_COUNTS = """
        CREATE TABLE IF NOT EXISTS finding_counts (
            run_id INTEGER NOT NULL,
            finding_type TEXT NOT NULL,
            finding_count INTEGER NOT NULL,
            PRIMARY KEY (run_id, finding_type),
            FOREIGN KEY (run_id) REFERENCES runs(id) ON DELETE CASCADE
        )
        """;

    private static final String CREATE_INDEX =
        "CREATE INDEX IF NOT EXISTS idx_runs_repo_key_id ON runs(repo_key, id)";

    private static final String RUN_COLUMNS = """
        id, repo_path, scanned_at, functions_scanned, probable_ai_functions,
        high_confidence_duplication_pairs, runtime_zero_invocations,
        probable_ai_zero_invocations, estimated_annualized_avoidable_runtime_cost
        """;

    private final Path databasePath;
    private final Clock clock;

    public RunHistoryStore(Path databasePath) {
        this(databasePath, Clock.systemUTC());
    }

    public RunHistoryStore(Path databasePath, Clock clock) {
        this.databasePath = databasePath;
        this.clock = clock;
    }

    public RunHistory record(DiagnosticReport report) {
        return record(report.repository(), report.summary(), report.findings(), report.config());
    }

    /**
     * Inserts one run with its finding counts per type.
     *
     * @return the new run id and, unless this is the repository's first run,
     *         the previous run and the deltas against it
     * @throws RunHistoryException if the database cannot be opened or written
     */
    public RunHistory record(Path repository, DiagnosticSummary summary, List<Finding> findings,
                             AnalysisConfig config) {
        String repoPath = resolve(repository).toString();
        String repoKey = repoPath.toLowerCase(Locale.ROOT);
        String scannedAt = TIMESTAMP.format(clock.instant());

        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                initializeSchema(conn);
                long runId = insertRun(conn, repoKey, repoPath, scannedAt, summary, config);
                insertFindingCounts(conn, runId, findings);
                Optional<RecordedRun> previous = previousRun(conn, repoKey, runId);
                conn.commit();

                RunHistory history = previous
                    .map(run -> new RunHistory(runId, scannedAt, run.id(), run.scannedAt(),
                        RunTrend.between(summary, run)))
                    .orElseGet(() -> RunHistory.first(runId, scannedAt));
                log.info("Recorded run {} for {} in {}", runId, repoPath, databasePath);
                return history;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RunHistoryException("Failed to record run in " + databasePath, e);
        }
    }

    /**
     * All recorded runs of a repository, oldest first.
     */
    public List<RecordedRun> runs(Path repository) {
        String sql = "SELECT " + RUN_COLUMNS + " FROM runs WHERE repo_key = ? ORDER BY id";

        List<RecordedRun> runs = new ArrayList<>();
        try (Connection conn = connect()) {
            initializeSchema(conn);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, resolve(repository).toString().toLowerCase(Locale.ROOT));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        runs.add(mapRun(rs));
                    }
                }
            }
            return runs;
        } catch (SQLException e) {
            throw new RunHistoryException("Failed to query runs in " + databasePath, e);
        }
    }

    /**
     * Finding counts of one run, by finding type label.
     */
    public Map<String, Integer> findingCounts(long runId) {
        String sql = """
            SELECT finding_type, finding_count
            FROM finding_counts
            WHERE run_id = ?
            ORDER BY finding_type
            """;

        Map<String, Integer> counts = new LinkedHashMap<>();
        try (Connection conn = connect()) {
            initializeSchema(conn);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setLong(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        counts.put(rs.getString("finding_type"), rs.getInt("finding_count"));
                    }
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new RunHistoryException("Failed to query finding counts in " + databasePath, e);
        }
    }

    private Connection connect() throws SQLException {
        Path absolute = databasePath.toAbsolutePath();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException e) {
            throw new RunHistoryException("Cannot create directory for " + databasePath, e);
        }
        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + absolute);
        try (Statement statement = conn.createStatement()) {
            statement.execute("PRAGMA foreign_keys = ON");
        }
        return conn;
    }

    private static void initializeSchema(Connection conn) throws SQLException {
        try (Statement statement = conn.createStatement()) {
            statement.execute(CREATE_RUNS);
            statement.execute(CREATE_FINDING_COUNTS);
            statement.execute(CREATE_INDEX);
        }
    }

    private static long insertRun(Connection conn, String repoKey, String repoPath, String scannedAt,
                                  DiagnosticSummary summary, AnalysisConfig config) throws SQLException {
        String sql = """
            INSERT INTO runs
                (repo_key, repo_path, scanned_at, functions_scanned, probable_ai_functions,
                 high_confidence_duplication_pairs, runtime_zero_invocations,
                 probable_ai_zero_invocations, estimated_annualized_avoidable_runtime_cost,
                 ai_threshold, dup_threshold, min_dup_body_statements, min_dup_signature_chars,
                 include_tests, git_provenance_enabled)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, repoKey);
            ps.setString(2, repoPath);
            ps.setString(3, scannedAt);
            ps.setInt(4, summary.functionsScanned());
            ps.setInt(5, summary.probableAiFunctions());
            ps.setInt(6, summary.highConfidenceDuplicationPairs());
            ps.setInt(7, summary.runtimeZeroInvocations());
            ps.setInt(8, summary.probableAiZeroInvocations());
            ps.setDouble(9, summary.estimatedAnnualizedAvoidableRuntimeCost());
            ps.setDouble(10, config.provenanceThreshold());
            ps.setDouble(11, config.highThreshold());
            ps.setInt(12, config.minBodyStatements());
            ps.setInt(13, config.minSignatureChars());
            ps.setInt(14, config.includeTests() ? 1 : 0);
            ps.setInt(15, config.gitEvidenceEnabled() ? 1 : 0);
            ps.executeUpdate();
        }

        try (Statement statement = conn.createStatement();
             ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("No row id after insert");
            }
            return rs.getLong(1);
        }
    }

    private static void insertFindingCounts(Connection conn, long runId, List<Finding> findings)
            throws SQLException {
        Map<String, Long> counts = findings.stream()
            .collect(Collectors.groupingBy(finding -> finding.type().label(), TreeMap::new, Collectors.counting()));
        if (counts.isEmpty()) {
            return;
        }

        String sql = "INSERT INTO finding_counts (run_id, finding_type, finding_count) VALUES (?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (Map.Entry<String, Long> count : counts.entrySet()) {
                ps.setLong(1, runId);
                ps.setString(2, count.getKey());
                ps.setLong(3, count.getValue());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static Optional<RecordedRun> previousRun(Connection conn, String repoKey, long runId)
            throws SQLException {
        String sql = "SELECT " + RUN_COLUMNS + " FROM runs WHERE repo_key = ? AND id < ? ORDER BY id DESC LIMIT 1";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, repoKey);
            ps.setLong(2, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRun(rs)) : Optional.empty();
            }
        }
    }

    private static RecordedRun mapRun(ResultSet rs) throws SQLException {
        return new RecordedRun(
            rs.getLong("id"),
            rs.getString("repo_path"),
            rs.getString("scanned_at"),
            rs.getInt("functions_scanned"),
            rs.getInt("probable_ai_functions"),
            rs.getInt("high_confidence_duplication_pairs"),
            rs.getInt("runtime_zero_invocations"),
            rs.getInt("probable_ai_zero_invocations"),
            rs.getDouble("estimated_annualized_avoidable_runtime_cost")
        );
    }

    /** Real path when the repository exists, else its normalized absolute path. */
    private static Path resolve(Path repository) {
        Path absolute = repository.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            return absolute;
        }
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            throw new RunHistoryException("Cannot resolve repository " + repository, e);
        }
    }
}

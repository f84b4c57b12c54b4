package io.codewaste.git;

import io.codewaste.CodeEntity;
import io.codewaste.GitEvidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Collects blame and history statistics for entities.
 *
 * <p>History is loaded once per file and blame once per entity. Outside a
 * git work tree the result is empty.</p>
 */
public class GitEvidenceCollector {

    private static final Logger log = LoggerFactory.getLogger(GitEvidenceCollector.class);

    private static final long SECONDS_PER_DAY = 86_400L;

    private final Function<Path, GitClient> clients;
    private final Clock clock;

    public GitEvidenceCollector() {
        this(ProcessGitClient::new, Clock.systemUTC());
    }

    public GitEvidenceCollector(Function<Path, GitClient> clients, Clock clock) {
        this.clients = clients;
        this.clock = clock;
    }

    /**
     * @param root     repository root
     * @param entities entities to attribute
     * @return evidence by entity id, in entity order; empty if the root is not a work tree
     */
    public Map<String, GitEvidence> collect(Path root, List<CodeEntity> entities) {
        GitClient git = clients.apply(root.toAbsolutePath().normalize());
        if (!git.isWorkTree()) {
            log.debug("{} is not a git work tree; no git evidence", root);
            return Map.of();
        }

        Map<String, List<CodeEntity>> byFile = new LinkedHashMap<>();
        for (CodeEntity entity : entities) {
            byFile.computeIfAbsent(entity.filePath(), k -> new ArrayList<>()).add(entity);
        }

        Map<String, GitEvidence> evidence = new LinkedHashMap<>();
        for (Map.Entry<String, List<CodeEntity>> file : byFile.entrySet()) {
            List<CommitRef> history = git.fileHistory(file.getKey()).orElse(List.of());
            int fileCommits = (int) history.stream().map(CommitRef::commit).distinct().count();
            int fileAuthors = (int) history.stream().map(CommitRef::author)
                .filter(author -> !author.isEmpty()).distinct().count();

            for (CodeEntity entity : file.getValue()) {
                Optional<List<BlameLine>> blame = git.blame(file.getKey(), entity.lineStart(), entity.lineEnd());
                evidence.put(entity.id(), blame.filter(lines -> !lines.isEmpty())
                    .map(lines -> fromBlame(entity.id(), lines, fileCommits, fileAuthors))
                    .orElseGet(() -> GitEvidence.unavailable(entity.id(), fileCommits, fileAuthors)));
            }
        }

        log.debug("Collected git evidence for {} entities", evidence.size());
        return evidence;
    }

    GitEvidence fromBlame(String entityId, List<BlameLine> lines, int fileCommits, int fileAuthors) {
        Map<String, Integer> linesPerCommit = new HashMap<>();
        for (BlameLine line : lines) {
            linesPerCommit.merge(line.commit(), 1, Integer::sum);
        }
        int dominant = linesPerCommit.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        double concentration = Math.round((double) dominant / lines.size() * 1000.0) / 1000.0;

        int authors = (int) lines.stream().map(BlameLine::author).filter(Objects::nonNull).distinct().count();

        long newest = lines.stream().map(BlameLine::authorTime).filter(Objects::nonNull)
            .mapToLong(Long::longValue).max().orElse(0L);
        int ageDays = 0;
        if (newest != 0) {
            long now = clock.instant().getEpochSecond();
            ageDays = (int) Math.max(Math.floorDiv(now - newest, SECONDS_PER_DAY), 0L);
        }

        return new GitEvidence(entityId, true, linesPerCommit.size(), authors, concentration, ageDays,
            fileCommits, fileAuthors);
    }
}

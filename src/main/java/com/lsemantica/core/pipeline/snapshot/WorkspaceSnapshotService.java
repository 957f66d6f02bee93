package com.lsemantica.core.pipeline.snapshot;

import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.Envelopes;
import com.lsemantica.core.pipeline.PathGlobs;
import com.lsemantica.core.trace.GovernanceHooks;
import com.lsemantica.core.trace.HookResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Captures a {@link WorkspaceSnapshot}: git head, branch and dirty state plus a file inventory,
 * bound together by a SHA-256 hash over the canonical JSON of all of it.
 */
@Service
public class WorkspaceSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSnapshotService.class);

    public static final List<String> DEFAULT_IGNORED_PATHS = List.of(".git/**", "node_modules/**");

    static final Map<String, String> LANGUAGE_BY_EXTENSION = Map.ofEntries(
            Map.entry(".cjs", "JavaScript"),
            Map.entry(".java", "Java"),
            Map.entry(".js", "JavaScript"),
            Map.entry(".json", "JSON"),
            Map.entry(".jsx", "JavaScript"),
            Map.entry(".ls", "L-Semantica"),
            Map.entry(".md", "Markdown"),
            Map.entry(".mdx", "Markdown"),
            Map.entry(".mjs", "JavaScript"),
            Map.entry(".sh", "Shell"),
            Map.entry(".ts", "TypeScript"),
            Map.entry(".tsx", "TypeScript"),
            Map.entry(".yaml", "YAML"),
            Map.entry(".yml", "YAML"));

    private final GitMetadataReader gitMetadataReader;

    public WorkspaceSnapshotService(GitMetadataReader gitMetadataReader) {
        this.gitMetadataReader = gitMetadataReader;
    }

    public WorkspaceSnapshot capture(WorkspaceSnapshotOptions options) {
        String rawRoot = HookResolver.trimToNull(options == null ? null : options.workspaceRoot());
        if (rawRoot == null) {
            throw new WorkspaceSnapshotException(WorkspaceSnapshotException.Code.INVALID_WORKSPACE_ROOT,
                    "Workspace snapshot workspaceRoot must be a non-empty string", null);
        }
        Path root = resolveRoot(rawRoot);
        List<String> ignoredPaths = options.ignoredPaths() == null
                ? DEFAULT_IGNORED_PATHS
                : PathGlobs.normalizePatterns(options.ignoredPaths(),
                        message -> new WorkspaceSnapshotException(
                                WorkspaceSnapshotException.Code.INVALID_IGNORED_PATHS, message, root.toString()),
                        "Workspace snapshot ignoredPaths must contain only non-empty strings");

        List<FileRecord> files = inventory(root, ignoredPaths);
        TreeSet<String> languages = new TreeSet<>();
        int supported = 0;
        for (FileRecord file : files) {
            if (file.language() != null) {
                supported++;
                languages.add(file.language());
            }
        }
        GitMetadataReader.GitSummary git = gitMetadataReader.read(root);

        String snapshotHash = "sha256:" + CanonicalJson.sha256OfJson(hashInput(git, files, supported,
                List.copyOf(languages), ignoredPaths));
        WorkspaceSnapshot.Payload payload = new WorkspaceSnapshot.Payload(
                new WorkspaceSnapshot.Git(git.headSha(), git.branch(), git.dirty()),
                new WorkspaceSnapshot.Inventory(files.size(), supported, List.copyOf(languages)),
                new WorkspaceSnapshot.Filters(ignoredPaths),
                snapshotHash);

        GovernanceHooks hooks = options.hooks() != null ? options.hooks() : GovernanceHooks.systemClock();
        WorkspaceSnapshot snapshot = new WorkspaceSnapshot(
                ArtifactType.WORKSPACE_SNAPSHOT.typeId(),
                ArtifactType.WORKSPACE_SNAPSHOT.schemaVersion(),
                ArtifactType.WORKSPACE_SNAPSHOT.idPrefix() + Envelopes.shortDigest(snapshotHash),
                Envelopes.runId(hooks, null),
                Envelopes.producedAt(hooks),
                Envelopes.toolVersion(options.toolVersion()),
                List.of(),
                new WorkspaceSnapshot.Trace(root.toString(), WorkspaceSnapshot.TRACE_SOURCE),
                payload);
        log.info("Workspace snapshot {} at {} ({} files, {} supported, dirty={})", snapshot.artifactId(),
                git.headSha(), files.size(), supported, git.dirty());
        return snapshot;
    }

    private static Path resolveRoot(String rawRoot) {
        try {
            return WorkspaceScanner.resolveRoot(rawRoot);
        } catch (WorkspaceScanner.InvalidRootException e) {
            if (e.notDirectory()) {
                throw new WorkspaceSnapshotException(WorkspaceSnapshotException.Code.WORKSPACE_ROOT_NOT_DIRECTORY,
                        "Workspace snapshot workspaceRoot must point to a directory", e.resolvedRoot(), e);
            }
            throw new WorkspaceSnapshotException(WorkspaceSnapshotException.Code.WORKSPACE_ROOT_UNREADABLE,
                    "Workspace snapshot workspaceRoot is unreadable or does not exist", rawRoot, e);
        }
    }

    private static List<FileRecord> inventory(Path root, List<String> ignoredPaths) {
        List<WorkspaceScanner.ScannedFile> scanned;
        try {
            scanned = WorkspaceScanner.scan(root, ignoredPaths);
        } catch (WorkspaceScanner.UnreadableEntryException e) {
            throw new WorkspaceSnapshotException(WorkspaceSnapshotException.Code.WORKSPACE_ENTRY_UNREADABLE,
                    "Workspace snapshot encountered an unreadable " + (e.directory() ? "directory" : "file")
                            + " entry", root.toString(), e);
        }
        List<FileRecord> records = new ArrayList<>(scanned.size());
        for (WorkspaceScanner.ScannedFile file : scanned) {
            records.add(new FileRecord(file.path(), file.sizeBytes(), languageOf(file.path())));
        }
        return records;
    }

    static String languageOf(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return null;
        }
        return LANGUAGE_BY_EXTENSION.get(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    private static Map<String, Object> hashInput(GitMetadataReader.GitSummary git, List<FileRecord> files,
                                                 int supported, List<String> languages, List<String> ignoredPaths) {
        Map<String, Object> gitPart = new LinkedHashMap<>();
        gitPart.put("head_sha", git.headSha());
        gitPart.put("branch", git.branch());
        gitPart.put("is_dirty", git.dirty());
        gitPart.put("status_porcelain", git.statusPorcelain());

        Map<String, Object> inventoryPart = new LinkedHashMap<>();
        inventoryPart.put("files_scanned", files.size());
        inventoryPart.put("files_supported", supported);
        inventoryPart.put("languages", languages);
        inventoryPart.put("files", files);

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("git", gitPart);
        input.put("inventory", inventoryPart);
        input.put("filters", Map.of("ignored_paths", ignoredPaths));
        return input;
    }

    record FileRecord(String path, long sizeBytes, String language) {}
}

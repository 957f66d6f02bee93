package com.lsemantica.core.pipeline.intent;

import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.lsdoc.LsDocument;
import com.lsemantica.core.lsdoc.LsDocumentReader;
import com.lsemantica.core.lsdoc.SourceRange;
import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.ArtifactRef;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.Envelopes;
import com.lsemantica.core.pipeline.PathGlobs;
import com.lsemantica.core.pipeline.ReasonCode;
import com.lsemantica.core.pipeline.snapshot.WorkspaceScanner;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshot;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshotService;
import com.lsemantica.core.trace.HookResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Maps a free-text intent onto ranked workspace targets. {@code .ls} files that parse
 * contribute one candidate per goal, capability and check; other text files contribute a
 * single whole-file candidate. The top candidate must clear the confidence floor and be
 * separated from the runner-up by more than the ambiguity gap before the mapping continues.
 */
@Service
public class IntentMappingService {

    private static final Logger log = LoggerFactory.getLogger(IntentMappingService.class);

    public static final String DEFAULT_INTENT_SOURCE = "user_prompt";
    public static final double DEFAULT_MIN_CONFIDENCE = 0.75;
    public static final double DEFAULT_AMBIGUITY_GAP = 0.05;
    public static final int DEFAULT_MAX_ALTERNATIVES = 5;
    static final int MAX_ALTERNATIVES_LIMIT = 50;
    static final int MAX_TEXT_SCAN_BYTES = 256_000;
    private static final int READABLE_TARGET_LENGTH = 96;

    static final Set<String> TEXT_EXTENSIONS = Set.of(
            ".cjs", ".java", ".js", ".json", ".jsx", ".ls", ".md", ".mdx", ".mjs", ".sh", ".ts", ".tsx", ".txt",
            ".yaml", ".yml");

    private static final Comparator<IntentMapping.Candidate> RANKING =
            Comparator.comparingDouble(IntentMapping.Candidate::confidence).reversed()
                    .thenComparing(candidate -> candidate.provenance().method() == ExtractionMethod.AST_SYMBOL_LOOKUP
                            ? 0 : 1)
                    .thenComparing(IntentMapping.Candidate::path)
                    .thenComparing(candidate -> candidate.symbolPath() == null ? "" : candidate.symbolPath());

    public IntentMapping map(WorkspaceSnapshot snapshot, IntentMappingOptions options) {
        Envelopes.requireEnvelope(snapshot, ArtifactType.WORKSPACE_SNAPSHOT, ArtifactType.INTENT_MAPPING,
                message -> invalid(IntentMappingException.Code.INVALID_WORKSPACE_SNAPSHOT, message));
        String rawRoot = snapshot.trace() == null ? null : HookResolver.trimToNull(snapshot.trace().workspaceRoot());
        if (rawRoot == null) {
            throw invalid(IntentMappingException.Code.INVALID_WORKSPACE_SNAPSHOT,
                    "Intent mapping workspace snapshot must include a non-empty trace.workspace_root");
        }
        List<String> ignoredPaths = ignoredPaths(snapshot);
        Path root = resolveRoot(rawRoot);

        String intent = HookResolver.trimToNull(options == null ? null : options.intent());
        if (intent == null) {
            throw invalid(IntentMappingException.Code.INVALID_INTENT,
                    "Intent mapping requires a non-empty intent string");
        }
        String intentSource = DEFAULT_INTENT_SOURCE;
        if (options.intentSource() != null) {
            intentSource = HookResolver.trimToNull(options.intentSource());
            if (intentSource == null) {
                throw invalid(IntentMappingException.Code.INVALID_INTENT_SOURCE,
                        "Intent mapping intentSource must be a non-empty string when provided");
            }
        }
        double minConfidence = unitInterval(options.minConfidence(), DEFAULT_MIN_CONFIDENCE, "minConfidence");
        double ambiguityGap = unitInterval(options.ambiguityGap(), DEFAULT_AMBIGUITY_GAP, "ambiguityGap");
        int maxAlternatives = options.maxAlternatives() == null ? DEFAULT_MAX_ALTERNATIVES : options.maxAlternatives();
        if (maxAlternatives < 0 || maxAlternatives > MAX_ALTERNATIVES_LIMIT) {
            throw invalid(IntentMappingException.Code.INVALID_OPTIONS,
                    "Intent mapping maxAlternatives must be an integer between 0 and " + MAX_ALTERNATIVES_LIMIT);
        }

        Query query = new Query(SearchText.normalize(intent), SearchText.tokenize(intent));
        Set<ExtractionMethod> methodsUsed = new TreeSet<>();
        List<IntentMapping.Candidate> ranked = collect(root, ignoredPaths, query, methodsUsed);
        ranked.sort(RANKING);

        Outcome outcome = decide(ranked, minConfidence, ambiguityGap, maxAlternatives);
        List<ExtractionMethod> methods = methodsUsed.isEmpty()
                ? List.of(ExtractionMethod.AST_SYMBOL_LOOKUP, ExtractionMethod.TEXT_MATCH)
                : List.copyOf(methodsUsed);

        IntentMapping.Trace trace = new IntentMapping.Trace(intentSource, methods);
        IntentMapping.Payload payload = new IntentMapping.Payload(
                new IntentMapping.Intent(intent),
                outcome.candidates(),
                outcome.alternatives(),
                outcome.decision(),
                outcome.reasonCode(),
                outcome.reasonDetail());
        List<ArtifactRef> inputs = List.of(snapshot.ref());
        IntentMapping mapping = new IntentMapping(
                ArtifactType.INTENT_MAPPING.typeId(),
                ArtifactType.INTENT_MAPPING.schemaVersion(),
                Envelopes.artifactId(ArtifactType.INTENT_MAPPING, inputs, trace, payload),
                Envelopes.runId(options.hooks(), snapshot.runId()),
                Envelopes.producedAt(options.hooks()),
                Envelopes.toolVersion(options.toolVersion()),
                inputs,
                trace,
                payload);
        log.info("Intent mapping {} -> {}/{} ({} ranked candidate(s))", mapping.artifactId(),
                outcome.decision().wireValue(), outcome.reasonCode().wireValue(), ranked.size());
        return mapping;
    }

    private List<IntentMapping.Candidate> collect(Path root, List<String> ignoredPaths, Query query,
                                                  Set<ExtractionMethod> methodsUsed) {
        List<WorkspaceScanner.ScannedFile> files;
        try {
            files = WorkspaceScanner.scan(root, ignoredPaths);
        } catch (WorkspaceScanner.UnreadableEntryException e) {
            throw new IntentMappingException(IntentMappingException.Code.WORKSPACE_ENTRY_UNREADABLE,
                    "Intent mapping encountered an unreadable " + (e.directory() ? "directory" : "file") + " entry", e);
        }

        List<IntentMapping.Candidate> candidates = new ArrayList<>();
        for (WorkspaceScanner.ScannedFile file : files) {
            String extension = extension(file.path());
            if (!TEXT_EXTENSIONS.contains(extension) || file.sizeBytes() > MAX_TEXT_SCAN_BYTES) {
                continue;
            }
            String source = readSource(file);
            if (extension.equals(".ls")) {
                List<IntentMapping.Candidate> astCandidates = astCandidates(file.path(), source, query);
                if (!astCandidates.isEmpty()) {
                    candidates.addAll(astCandidates);
                    methodsUsed.add(ExtractionMethod.AST_SYMBOL_LOOKUP);
                    continue;
                }
            }
            String text = source.length() > MAX_TEXT_SCAN_BYTES ? source.substring(0, MAX_TEXT_SCAN_BYTES) : source;
            Target target = new Target(file.path(), null, null, "file", List.of(text), ExtractionMethod.TEXT_MATCH,
                    bestLineRange(source, query));
            IntentMapping.Candidate candidate = score(target, query);
            if (candidate != null) {
                candidates.add(candidate);
                methodsUsed.add(ExtractionMethod.TEXT_MATCH);
            }
        }
        log.debug("Collected {} candidate(s) from {} file(s)", candidates.size(), files.size());
        return candidates;
    }

    private static List<IntentMapping.Candidate> astCandidates(String path, String source, Query query) {
        LsDocument document = LsDocumentReader.read(source).documentIfValid().orElse(null);
        if (document == null) {
            return List.of();
        }
        List<Target> targets = new ArrayList<>();
        targets.add(new Target(path, "goal", document.goal().value(), "goal", List.of(document.goal().value()),
                ExtractionMethod.AST_SYMBOL_LOOKUP, range(document.goal().range())));
        for (LsDocument.Declaration capability : document.capabilities()) {
            targets.add(declarationTarget(path, "capability", capability));
        }
        for (LsDocument.Declaration check : document.checks()) {
            targets.add(declarationTarget(path, "check", check));
        }
        List<IntentMapping.Candidate> candidates = new ArrayList<>();
        for (Target target : targets) {
            IntentMapping.Candidate candidate = score(target, query);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    private static Target declarationTarget(String path, String kind, LsDocument.Declaration declaration) {
        return new Target(path, kind + ":" + declaration.name(), declaration.name(), kind,
                List.of(declaration.name(), declaration.description()), ExtractionMethod.AST_SYMBOL_LOOKUP,
                range(declaration.range()));
    }

    /**
     * Scores one target against the intent. Returns {@code null} when the target shares no
     * token, phrase, symbol name or path base name with the intent.
     */
    static IntentMapping.Candidate score(Target target, Query query) {
        Set<String> intentTokens = new HashSet<>(query.tokens());
        String joined = target.path() + " " + String.join(" ", target.texts());
        List<String> targetTokens = SearchText.tokenize(joined);
        long shared = targetTokens.stream().filter(intentTokens::contains).count();
        double overlap = intentTokens.isEmpty() ? 0 : (double) shared / intentTokens.size();
        double coverage = targetTokens.isEmpty() ? 0 : (double) shared / targetTokens.size();

        String targetNormalized = SearchText.normalize(joined);
        String intentNormalized = query.normalized();
        boolean phraseHit = intentNormalized.length() >= 4 && !targetNormalized.isEmpty()
                && (targetNormalized.contains(intentNormalized) || intentNormalized.contains(targetNormalized));
        String symbolNormalized = target.symbolName() == null ? "" : SearchText.normalize(target.symbolName());
        boolean symbolHit = !symbolNormalized.isEmpty() && intentNormalized.contains(symbolNormalized);
        String baseNormalized = SearchText.normalize(target.path().substring(target.path().lastIndexOf('/') + 1));
        boolean pathBaseHit = !baseNormalized.isEmpty()
                && (intentNormalized.contains(baseNormalized) || baseNormalized.contains(intentNormalized));

        if (shared == 0 && !phraseHit && !symbolHit && !pathBaseHit) {
            return null;
        }

        boolean ast = target.method() == ExtractionMethod.AST_SYMBOL_LOOKUP;
        double score = ast ? 0.38 : 0.18;
        score += overlap * 0.4;
        score += coverage * 0.08;
        if (phraseHit) {
            score += ast ? 0.1 : 0.12;
        }
        if (symbolHit) {
            score += 0.24;
        }
        if (ast && !target.kind().equals("file") && intentNormalized.contains(target.kind())) {
            score += 0.05;
        }
        if (pathBaseHit) {
            score += 0.05;
        }

        StringBuilder rationale = new StringBuilder(ast ? "AST symbol lookup" : "Text match")
                .append("; token overlap ").append(shared).append('/').append(Math.max(1, intentTokens.size()));
        if (symbolHit) {
            rationale.append("; exact symbol-name hit");
        }
        if (phraseHit || pathBaseHit) {
            rationale.append("; exact phrase/path substring hit");
        }
        rationale.append('.');

        IntentMapping.Provenance provenance = new IntentMapping.Provenance(target.path(), target.method(),
                target.range());
        return new IntentMapping.Candidate(targetId(target.path(), target.symbolPath()), target.path(),
                target.symbolPath(), roundConfidence(score), rationale.toString(), provenance);
    }

    /**
     * Finds the first line with the highest count of intent tokens, with a bonus when the line
     * contains the whole normalized intent. {@code null} when no line scores.
     */
    static IntentMapping.CandidateRange bestLineRange(String source, Query query) {
        String[] lines = source.split("\\r?\\n", -1);
        int bestLine = -1;
        int bestScore = 0;
        for (int i = 0; i < lines.length; i++) {
            Set<String> lineTokens = new HashSet<>(SearchText.tokenize(lines[i]));
            int lineScore = (int) query.tokens().stream().filter(lineTokens::contains).count();
            if (!query.normalized().isEmpty() && SearchText.normalize(lines[i]).contains(query.normalized())) {
                lineScore += query.tokens().isEmpty() ? 1 : query.tokens().size();
            }
            if (lineScore > bestScore) {
                bestScore = lineScore;
                bestLine = i;
            }
        }
        if (bestLine < 0) {
            return null;
        }
        int lineNumber = bestLine + 1;
        return new IntentMapping.CandidateRange(lineNumber, 1, lineNumber, Math.max(1, lines[bestLine].length() + 1));
    }

    /** Readable, length-capped id plus a digest of the raw {@code path#symbol} key. */
    static String targetId(String path, String symbolPath) {
        String raw = path + "#" + (symbolPath == null ? "file" : symbolPath);
        String readable = raw.replaceAll("[^A-Za-z0-9._/#+:-]", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_+|_+$", "");
        if (readable.length() > READABLE_TARGET_LENGTH) {
            readable = readable.substring(0, READABLE_TARGET_LENGTH);
        }
        if (readable.isEmpty()) {
            readable = "target";
        }
        return readable + "_" + CanonicalJson.sha256Hex(raw).substring(0, 12);
    }

    static double roundConfidence(double score) {
        double clamped = Math.max(0.01, Math.min(0.99, score));
        return Math.round(clamped * 10_000) / 10_000.0;
    }

    private static Outcome decide(List<IntentMapping.Candidate> ranked, double minConfidence, double ambiguityGap,
                                  int maxAlternatives) {
        if (ranked.isEmpty()) {
            return new Outcome(List.of(), List.of(), Decision.STOP, ReasonCode.UNSUPPORTED_INPUT,
                    "No supported repository targets matched the requested intent.");
        }
        IntentMapping.Candidate top = ranked.get(0);
        if (top.confidence() < minConfidence) {
            return new Outcome(List.of(top), head(ranked.subList(1, ranked.size()), maxAlternatives),
                    Decision.ESCALATE, ReasonCode.MAPPING_LOW_CONFIDENCE,
                    String.format(Locale.ROOT, "Top mapping candidate scored %.4f below minimum confidence %.4f.",
                            top.confidence(), minConfidence));
        }

        List<IntentMapping.Candidate> ambiguous = new ArrayList<>();
        List<IntentMapping.Candidate> rest = new ArrayList<>();
        for (IntentMapping.Candidate candidate : ranked) {
            if (candidate.confidence() >= minConfidence && top.confidence() - candidate.confidence() <= ambiguityGap) {
                ambiguous.add(candidate);
            } else {
                rest.add(candidate);
            }
        }
        if (ambiguous.size() > 1) {
            String keys = ambiguous.stream().map(IntentMapping.Candidate::key).collect(Collectors.joining(", "));
            return new Outcome(List.copyOf(ambiguous), head(rest, maxAlternatives), Decision.ESCALATE,
                    ReasonCode.MAPPING_AMBIGUOUS,
                    String.format(Locale.ROOT, "Multiple high-confidence targets remain within ambiguity gap %.4f: %s.",
                            ambiguityGap, keys));
        }
        return new Outcome(List.of(top), head(ranked.subList(1, ranked.size()), maxAlternatives), Decision.CONTINUE,
                ReasonCode.OK, "Single high-confidence target selected");
    }

    private static List<IntentMapping.Candidate> head(List<IntentMapping.Candidate> candidates, int limit) {
        return List.copyOf(candidates.subList(0, Math.min(limit, candidates.size())));
    }

    private static List<String> ignoredPaths(WorkspaceSnapshot snapshot) {
        WorkspaceSnapshot.Payload payload = snapshot.payload();
        if (payload == null || payload.filters() == null || payload.filters().ignoredPaths() == null) {
            return WorkspaceSnapshotService.DEFAULT_IGNORED_PATHS;
        }
        return PathGlobs.normalizePatterns(payload.filters().ignoredPaths(),
                message -> invalid(IntentMappingException.Code.INVALID_WORKSPACE_SNAPSHOT, message),
                "Intent mapping workspace snapshot payload.filters.ignored_paths must contain only non-empty strings");
    }

    private static Path resolveRoot(String rawRoot) {
        try {
            return WorkspaceScanner.resolveRoot(rawRoot);
        } catch (WorkspaceScanner.InvalidRootException e) {
            if (e.notDirectory()) {
                throw new IntentMappingException(IntentMappingException.Code.WORKSPACE_ROOT_NOT_DIRECTORY,
                        "Intent mapping workspace root must point to a directory", e);
            }
            throw new IntentMappingException(IntentMappingException.Code.WORKSPACE_ROOT_UNREADABLE,
                    "Intent mapping workspace root is unreadable or does not exist", e);
        }
    }

    private static String readSource(WorkspaceScanner.ScannedFile file) {
        try {
            return new String(Files.readAllBytes(file.absolutePath()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IntentMappingException(IntentMappingException.Code.WORKSPACE_ENTRY_UNREADABLE,
                    "Intent mapping encountered an unreadable file entry", e);
        }
    }

    private static double unitInterval(Double value, double fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNaN() || value < 0 || value > 1) {
            throw invalid(IntentMappingException.Code.INVALID_OPTIONS,
                    "Intent mapping " + name + " must be a number between 0 and 1");
        }
        return value;
    }

    private static String extension(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static IntentMapping.CandidateRange range(SourceRange range) {
        return new IntentMapping.CandidateRange(range.start().line(), range.start().column(), range.end().line(),
                range.end().column());
    }

    private static IntentMappingException invalid(IntentMappingException.Code code, String message) {
        return new IntentMappingException(code, message);
    }

    record Query(String normalized, List<String> tokens) {}

    /**
     * @param kind {@code goal}, {@code capability}, {@code check} or {@code file}
     */
    record Target(String path, String symbolPath, String symbolName, String kind, List<String> texts,
                  ExtractionMethod method, IntentMapping.CandidateRange range) {}

    private record Outcome(List<IntentMapping.Candidate> candidates, List<IntentMapping.Candidate> alternatives,
                           Decision decision, ReasonCode reasonCode, String reasonDetail) {}
}

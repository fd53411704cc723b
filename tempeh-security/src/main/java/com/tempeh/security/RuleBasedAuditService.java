package com.tempeh.security;

import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.audit.AuditFinding;
import com.tempeh.plugin.audit.AuditResult;
import com.tempeh.plugin.audit.AuditService;
import com.tempeh.plugin.audit.Severity;
import com.tempeh.plugin.manifest.ManifestReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Audits plugin sources by matching {@link AuditRule}s against their text content.
 * <ul>
 *   <li>Directory sources: every regular text file (by extension), in path order. Content is decoded as
 *       UTF-8 with malformed bytes replaced. A file larger than {@value #MAX_FILE_BYTES} bytes, or one that
 *       cannot be read, is not scanned and yields a {@link Severity#CRITICAL} finding instead.</li>
 *   <li>Classpath sources: the manifest resource only.</li>
 * </ul>
 * At most one finding is recorded per rule and file. The audit passes when no finding is at or above the
 * severity threshold; findings below it are still reported.
 */
public final class RuleBasedAuditService implements AuditService {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedAuditService.class);

    public static final long MAX_FILE_BYTES = 1024 * 1024;

    public static final String OVERSIZED_FILE = "oversized-file";
    public static final String UNREADABLE_FILE = "unreadable-file";

    public static final Set<String> TEXT_EXTENSIONS = Set.of(
            "java", "js", "json", "kt", "groovy", "properties", "sh", "yaml", "yml");

    private final List<AuditRule> rules;
    private final Severity threshold;
    private final ClassLoader classLoader;

    public RuleBasedAuditService(Severity threshold) {
        this(DefaultAuditRules.rules(), threshold);
    }

    public RuleBasedAuditService(List<AuditRule> rules, Severity threshold) {
        this(rules, threshold, RuleBasedAuditService.class.getClassLoader());
    }

    public RuleBasedAuditService(List<AuditRule> rules, Severity threshold, ClassLoader classLoader) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    public Severity getThreshold() {
        return threshold;
    }

    public List<AuditRule> getRules() {
        return rules;
    }

    @Override
    public AuditResult validate(PluginSource source) throws InterruptedException {
        Objects.requireNonNull(source, "source");
        List<AuditFinding> findings = source.isDirectory() ? scanDirectory(source.getPath()) : scanClasspath(source);
        boolean passed = findings.stream().noneMatch(f -> f.getSeverity().isAtLeast(threshold));
        if (!passed) {
            log.warn("Audit failed for {}: {}", source, findings);
        } else if (!findings.isEmpty()) {
            log.info("Audit passed for {} with {} finding(s) below {}", source, findings.size(), threshold);
        } else {
            log.debug("Audit passed for {}", source);
        }
        return new AuditResult(passed, findings);
    }

    private List<AuditFinding> scanDirectory(Path dir) throws InterruptedException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(dir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(RuleBasedAuditService::isTextFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            log.warn("Cannot scan plugin directory {}: {}", dir, e.getMessage());
            return List.of(new AuditFinding(Severity.CRITICAL, "Plugin directory could not be scanned: " + e.getMessage(),
                    null, null));
        }
        List<AuditFinding> findings = new ArrayList<>();
        for (Path file : files) {
            checkInterrupted();
            String location = dir.relativize(file).toString().replace('\\', '/');
            try {
                if (Files.size(file) > MAX_FILE_BYTES) {
                    log.warn("Cannot audit {}: larger than {} bytes", file, MAX_FILE_BYTES);
                    findings.add(new AuditFinding(Severity.CRITICAL, "File exceeds " + MAX_FILE_BYTES
                            + " bytes and cannot be audited", OVERSIZED_FILE, location));
                    continue;
                }
                match(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), location, findings);
            } catch (IOException e) {
                log.warn("Cannot audit unreadable file {}: {}", file, e.getMessage());
                findings.add(new AuditFinding(Severity.CRITICAL, "File could not be read: " + e.getMessage(),
                        UNREADABLE_FILE, location));
            }
        }
        return findings;
    }

    private List<AuditFinding> scanClasspath(PluginSource source) throws InterruptedException {
        checkInterrupted();
        String resource = ManifestReader.classpathResource(source.getLocation());
        List<AuditFinding> findings = new ArrayList<>();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("No classpath manifest {} to audit", resource);
                return findings;
            }
            match(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource, findings);
        } catch (IOException e) {
            log.warn("Cannot read classpath manifest {} for audit: {}", resource, e.getMessage());
            findings.add(new AuditFinding(Severity.CRITICAL, "Manifest could not be read: " + e.getMessage(),
                    UNREADABLE_FILE, resource));
        }
        return findings;
    }

    private void match(String content, String location, List<AuditFinding> findings) {
        for (AuditRule rule : rules) {
            if (rule.matches(content)) {
                findings.add(new AuditFinding(rule.getSeverity(), rule.getDescription(), rule.getId(), location));
            }
        }
    }

    private static boolean isTextFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && TEXT_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("Audit cancelled");
        }
    }
}

package com.firewall.operation;

import com.firewall.core.Platform;
import com.firewall.path.PathExpander;
import com.firewall.path.PathMatcher;
import com.firewall.path.PathPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CommandPatternSet.
 */
class CommandPatternSetTest {

    private final CommandPatternSet patternSet = CommandPatternSet.defaults();
    private final PathMatcher posix = new PathMatcher(
            new PathExpander(Map.of(), "/home/tester", Platform.POSIX));
    private final PathMatcher windows = new PathMatcher(
            new PathExpander(Map.of("USERPROFILE", "C:\\Users\\tester"), "C:\\Users\\tester", Platform.WINDOWS));

    // =====================================================================
    // POSIX operations on a literal path
    // =====================================================================

    @ParameterizedTest(name = "[{0}] -> {1}")
    @CsvSource(delimiter = '#', quoteCharacter = '"', value = {
            "echo x > /etc/hosts # write",
            "echo x >/etc/hosts # write",
            "echo x > '/etc/hosts' # write",
            "echo x | tee /etc/hosts # write",
            "echo x >> /etc/hosts # append",
            "echo x | tee -a /etc/hosts # append",
            "sed -i 's/a/b/' /etc/hosts # edit",
            "sed -E -i.bak 's/a/b/' /etc/hosts # edit",
            "sed --in-place 's/a/b/' /etc/hosts # edit",
            "perl -pi -e 's/a/b/' /etc/hosts # edit",
            "mv /tmp/new /etc/hosts # move",
            "mv /etc/hosts /tmp/old # move",
            "cp /tmp/new /etc/hosts # copy",
            "rm /etc/hosts # delete",
            "unlink /etc/hosts # delete",
            "shred -u /etc/hosts # delete",
            "chmod 600 /etc/hosts # chmod",
            "chown root /etc/hosts # chown",
            "chgrp wheel /etc/hosts # chgrp",
            "truncate -s 0 /etc/hosts # truncate",
            ": > /etc/hosts # truncate",
            ":>/etc/hosts # truncate",
            "RM /ETC/HOSTS # delete"
    })
    @DisplayName("Should recognize modifying operations on a literal path")
    void shouldRecognizeOperations(String command, String operation) {
        List<CompiledOperationRule> rules =
                patternSet.compile(PathPattern.of("/etc/hosts"), OperationType.modifying(), posix);

        assertEquals(Optional.of(operation), CommandPatternSet.matchAny(command, rules));
    }

    @ParameterizedTest(name = "[{0}]")
    @CsvSource(delimiter = '#', quoteCharacter = '"', value = {
            "cat /etc/hosts",
            "grep localhost /etc/hosts",
            "tail -f /etc/hosts",
            "sed -n 1p /etc/hosts",
            "cp /etc/hosts /tmp/copy",
            "cat /etc/hosts > /tmp/copy",
            "rm /tmp/other"
    })
    @DisplayName("Reads and unrelated commands are not operations on the path")
    void shouldIgnoreReads(String command) {
        List<CompiledOperationRule> rules =
                patternSet.compile(PathPattern.of("/etc/hosts"), OperationType.modifying(), posix);

        assertEquals(Optional.empty(), CommandPatternSet.matchAny(command, rules));
    }

    @Test
    @DisplayName("Deletion set only contains delete templates")
    void deletionSetOnlyDeletes() {
        List<CompiledOperationRule> rules =
                patternSet.compile(PathPattern.of("/var/log/app.log"), OperationType.deletion(), posix);

        assertEquals(Optional.of("delete"), CommandPatternSet.matchAny("rm -f /var/log/app.log", rules));
        assertEquals(Optional.empty(), CommandPatternSet.matchAny("echo x >> /var/log/app.log", rules));
        assertEquals(Optional.empty(), CommandPatternSet.matchAny("chmod 600 /var/log/app.log", rules));
        assertTrue(rules.stream().allMatch(r -> r.operation().equals("delete")));
    }

    @Test
    @DisplayName("Literal paths are checked in expanded and original form")
    void literalBothForms() {
        List<CompiledOperationRule> rules =
                patternSet.compile(PathPattern.of("~/.bashrc"), OperationType.modifying(), posix);

        assertEquals(Optional.of("write"), CommandPatternSet.matchAny("echo x > ~/.bashrc", rules));
        assertEquals(Optional.of("write"), CommandPatternSet.matchAny("echo x > /home/tester/.bashrc", rules));
    }

    @Test
    @DisplayName("Literal path text is escaped")
    void literalIsEscaped() {
        List<CompiledOperationRule> rules =
                patternSet.compile(PathPattern.of("/srv/app.conf"), OperationType.deletion(), posix);

        assertEquals(Optional.empty(), CommandPatternSet.matchAny("rm /srv/appxconf", rules));
    }

    @Test
    @DisplayName("Glob wildcards match within one path segment")
    void globOperations() {
        List<CompiledOperationRule> rules =
                patternSet.compile(PathPattern.of("*.lock"), OperationType.modifying(), posix);

        assertEquals(Optional.of("delete"), CommandPatternSet.matchAny("rm yarn.lock", rules));
        assertEquals(Optional.of("write"), CommandPatternSet.matchAny("echo {} > Cargo.lock", rules));
        assertEquals(Optional.empty(), CommandPatternSet.matchAny("cat yarn.lock", rules));
    }

    @Test
    @DisplayName("Reference matcher fires on any mention of the path")
    void referenceMatcher() {
        List<Pattern> references = patternSet.compileReference(PathPattern.of("~/.ssh/*"), posix);

        assertTrue(references.stream().anyMatch(p -> p.matcher("cat ~/.ssh/id_rsa").find()));
        assertTrue(references.stream().anyMatch(p -> p.matcher("cat /home/tester/.ssh/id_rsa").find()));
        assertFalse(references.stream().anyMatch(p -> p.matcher("cat ~/.sshx").find()));
    }

    @Test
    @DisplayName("Identical expanded and raw forms produce one fragment")
    void deduplicatesFragments() {
        assertEquals(1, patternSet.pathFragments(PathPattern.of("/etc/hosts"), posix).size());
        assertEquals(2, patternSet.pathFragments(PathPattern.of("~/.bashrc"), posix).size());
    }

    @Test
    @DisplayName("Malformed glob cannot be compiled")
    void malformedGlob() {
        assertThrows(PatternSyntaxException.class,
                () -> patternSet.compile(PathPattern.of("log[0-9"), OperationType.modifying(), posix));
    }

    @Test
    @DisplayName("First matching rule wins")
    void firstMatchWins() {
        List<CompiledOperationRule> rules =
                patternSet.compile(PathPattern.of("/etc/hosts"), OperationType.modifying(), posix);

        // both a write redirect and rm; write templates are declared first
        assertEquals(Optional.of("write"), CommandPatternSet.matchAny("rm /etc/hosts > /etc/hosts", rules));
    }

    // =====================================================================
    // Platform table
    // =====================================================================

    @Test
    @DisplayName("Only the active platform's templates are used")
    void platformTables() {
        assertTrue(patternSet.rules(Platform.POSIX, OperationType.modifying()).stream()
                .allMatch(r -> r.platform() == Platform.POSIX));
        assertTrue(patternSet.rules(Platform.WINDOWS, EnumSet.of(OperationType.DELETE)).stream()
                .allMatch(r -> r.platform() == Platform.WINDOWS && r.type() == OperationType.DELETE));
    }

    @ParameterizedTest(name = "[{0}] -> {1}")
    @CsvSource(delimiter = '#', quoteCharacter = '"', value = {
            "del C:\\Windows\\win.ini # delete",
            "Remove-Item -Path C:\\Windows\\win.ini # delete",
            "Set-Content C:\\Windows\\win.ini 'x' # write",
            "Add-Content -Path C:\\Windows\\win.ini -Value x # append",
            "Copy-Item x.ini C:\\Windows\\win.ini # copy",
            "icacls C:\\Windows\\win.ini /grant Everyone:F # icacls",
            "Clear-Content C:\\Windows\\win.ini # truncate"
    })
    @DisplayName("Should recognize Windows operations")
    void windowsOperations(String command, String operation) {
        List<CompiledOperationRule> rules =
                patternSet.compile(PathPattern.of("C:\\Windows\\win.ini"), OperationType.modifying(), windows);

        assertEquals(Optional.of(operation), CommandPatternSet.matchAny(command, rules));
    }

    @Test
    @DisplayName("POSIX syntax is not recognized on Windows")
    void posixSyntaxIgnoredOnWindows() {
        List<CompiledOperationRule> rules =
                patternSet.compile(PathPattern.of("C:\\Windows\\win.ini"), OperationType.deletion(), windows);

        assertEquals(Optional.empty(), CommandPatternSet.matchAny("shred C:\\Windows\\win.ini", rules));
    }

    @Test
    @DisplayName("Templates must contain the path placeholder")
    void templateNeedsPlaceholder() {
        assertThrows(IllegalArgumentException.class,
                () -> new OperationRule(OperationType.DELETE, "delete", "\\brm\\b", Platform.POSIX));
    }
}

package com.firewall;

import com.firewall.exception.ConfigurationException;
import com.firewall.hook.HookAdapter;
import com.firewall.hook.HookResponse;
import com.firewall.spring.EnableFirewall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Pre-tool-use hook entry point: reads one request from standard input, writes the
 * decision to standard output or standard error and exits with the hook exit code.
 */
@SpringBootApplication
@EnableFirewall
public class FirewallApplication {

    private static final Logger log = LoggerFactory.getLogger(FirewallApplication.class);

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    /**
     * Run the hook and return its exit code. A rule file that cannot be loaded is reported
     * on {@code err} and yields {@link HookResponse#EXIT_ERROR}.
     */
    static int run(String[] args, PrintStream err) {
        try {
            return SpringApplication.exit(SpringApplication.run(FirewallApplication.class, args));
        } catch (RuntimeException e) {
            ConfigurationException failure = findConfigurationFailure(e);
            if (failure == null) {
                throw e;
            }
            err.println("Error: " + failure.getMessage());
            return HookResponse.EXIT_ERROR;
        }
    }

    /**
     * The first {@link ConfigurationException} in the cause chain, or null. Bean creation wraps
     * it, and it wraps the parser error in turn.
     */
    static ConfigurationException findConfigurationFailure(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof ConfigurationException configurationException) {
                return configurationException;
            }
            Throwable cause = current.getCause();
            current = cause != current ? cause : null;
        }
        return null;
    }

    @Bean
    public HookRunner hookRunner(HookAdapter hookAdapter) {
        return new HookRunner(hookAdapter, System.in, System.out, System.err);
    }

    /**
     * Runs the hook once and exposes its exit code to {@link SpringApplication#exit}.
     */
    public static class HookRunner implements CommandLineRunner, ExitCodeGenerator {

        private final HookAdapter hookAdapter;
        private final InputStream in;
        private final PrintStream out;
        private final PrintStream err;
        private int exitCode = HookResponse.EXIT_ALLOW;

        public HookRunner(HookAdapter hookAdapter, InputStream in, PrintStream out, PrintStream err) {
            this.hookAdapter = hookAdapter;
            this.in = in;
            this.out = out;
            this.err = err;
        }

        @Override
        public void run(String... args) throws IOException {
            String request = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            HookResponse response = hookAdapter.handle(request);
            if (!response.stdout().isEmpty()) {
                out.println(response.stdout());
            }
            if (!response.stderr().isEmpty()) {
                err.println(response.stderr());
            }
            out.flush();
            err.flush();
            exitCode = response.exitCode();
            log.debug("Hook finished with exit code {}", exitCode);
        }

        @Override
        public int getExitCode() {
            return exitCode;
        }
    }
}

package dev.postify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Terminates the process on fatal startup errors.
 * Kept separate so tests can mock it instead of killing the runner.
 */
@Slf4j
@Component
public class ExitManager {

    public void exit(int status) {
        if (isTest()) {
            log.warn("Exit({}) suppressed under test", status);
            return;
        }
        System.exit(status);
    }

    protected boolean isTest() {
        String cp = System.getProperty("java.class.path", "");
        return cp.contains("junit") || cp.contains("surefire");
    }
}

package in.usermgmt.bootstrap;

import in.usermgmt.domain.user.User;
import in.usermgmt.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Runs before App wires anything. Throws IllegalStateException if configuration is invalid.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate() {
        log.info("Running startup config validation...");

        int capacity = Env.getInt(App.STORE_CAPACITY_KEY, 0);
        if (capacity < 0) {
            throw new IllegalStateException(
                "INVALID CONFIG: " + App.STORE_CAPACITY_KEY + " must be >= 0 (0 = unbounded), got " + capacity);
        }
        log.info("User store capacity: {}", capacity == 0 ? "unbounded" : capacity);

        boolean strictEmail = Env.getBool(App.STRICT_EMAIL_KEY, false);
        if (strictEmail) {
            String email = Env.get(App.DEMO_EMAIL_KEY, App.DEFAULT_DEMO_EMAIL);
            User probe = User.create(Env.get(App.DEMO_NAME_KEY, App.DEFAULT_DEMO_NAME), email);
            if (!probe.validateEmail()) {
                throw new IllegalStateException(
                    "INVALID CONFIG: " + App.DEMO_EMAIL_KEY + " is not an email address: '" + email + "'");
            }
            log.info("Strict email check passed");
        } else {
            log.info("Strict email check disabled");
        }

        log.info("Startup config validation passed");
    }

    private StartupConfigValidator() {}
}

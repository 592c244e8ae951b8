package in.usermgmt.bootstrap;

import in.usermgmt.application.service.UserService;
import in.usermgmt.domain.user.User;
import in.usermgmt.infrastructure.persistence.InMemoryUserRepository;
import in.usermgmt.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Smoke entry point: builds one user, prints its name, and stores it through the service.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final String DEMO_NAME_KEY = "DEMO_USER_NAME";
    static final String DEMO_EMAIL_KEY = "DEMO_USER_EMAIL";
    static final String STORE_CAPACITY_KEY = "USER_STORE_CAPACITY";
    static final String STRICT_EMAIL_KEY = "STRICT_EMAIL_CHECK";

    static final String DEFAULT_DEMO_NAME = "Alice";
    static final String DEFAULT_DEMO_EMAIL = "alice@example.com";

    public static void main(String[] args) {
        run(System.out);
    }

    static InMemoryUserRepository run(PrintStream out) {
        log.info("=== User management demo starting ===");
        StartupConfigValidator.validate();

        String name = Env.get(DEMO_NAME_KEY, DEFAULT_DEMO_NAME);
        String email = Env.get(DEMO_EMAIL_KEY, DEFAULT_DEMO_EMAIL);

        User user = User.create(name, email);
        out.println("Created user: " + user.name());

        InMemoryUserRepository repo = new InMemoryUserRepository(Env.getInt(STORE_CAPACITY_KEY, 0));
        UserService userService = new UserService(repo);
        userService.createUser(user.name(), user.email());

        log.info("[USERS] Stored demo user, store now holds {} user(s)", repo.count());
        return repo;
    }

    private App() {}
}

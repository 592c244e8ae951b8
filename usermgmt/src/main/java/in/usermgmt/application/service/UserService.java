package in.usermgmt.application.service;

import in.usermgmt.application.port.output.UserRepository;
import in.usermgmt.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * User workflows over an injected {@link UserRepository}.
 *
 * The service owns its repository for its whole lifetime. Repository failures
 * ({@link in.usermgmt.application.port.output.RepositoryException}) reach the caller unchanged.
 */
public final class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository repo;

    public UserService(UserRepository repo) {
        this.repo = Objects.requireNonNull(repo, "repo");
    }

    public Optional<User> getUser(long id) {
        return repo.findById(id);
    }

    /**
     * Build a new user and hand it to the repository.
     * The email is not validated here; see {@link User#validateEmail()}.
     */
    public void createUser(String name, String email) {
        User user = User.create(name, email);
        log.debug("[USERS] Saving new user name={}", name);
        repo.save(user);
    }
}

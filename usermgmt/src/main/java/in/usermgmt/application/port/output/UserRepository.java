package in.usermgmt.application.port.output;

import in.usermgmt.domain.user.User;

import java.util.Optional;

/**
 * Storage port for users.
 */
public interface UserRepository {
    /**
     * Find user by ID. Empty when no user is stored under that id.
     */
    Optional<User> findById(long id);

    /**
     * Save user. Id assignment and duplicate handling are up to the implementation.
     *
     * @throws RepositoryException if the user could not be stored
     */
    void save(User user);
}

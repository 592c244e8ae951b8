package in.usermgmt.infrastructure.persistence;

import in.usermgmt.application.port.output.RepositoryException;
import in.usermgmt.application.port.output.UserRepository;
import in.usermgmt.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of UserRepository.
 *
 * Id policy: users saved with id 0 get the next auto-increment id (starting at 1).
 * Users saved with an id are upserted under it and the sequence moves past it.
 * Ids are compared as unsigned 64-bit values.
 */
public class InMemoryUserRepository implements UserRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUserRepository.class);

    /** Capacity value meaning "no limit". */
    public static final int UNBOUNDED = 0;

    private final Map<Long, User> users = new LinkedHashMap<>();
    private final int capacity;
    private long lastId = 0L;

    public InMemoryUserRepository() {
        this(UNBOUNDED);
    }

    /**
     * @param capacity Maximum number of stored users, or {@link #UNBOUNDED}
     */
    public InMemoryUserRepository(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized Optional<User> findById(long id) {
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public synchronized void save(User user) {
        if (user == null) {
            throw new RepositoryException("user must not be null");
        }

        if (user.isPersisted() && users.containsKey(user.id())) {
            users.put(user.id(), user);
            log.debug("[USER-STORE] Updated user id={}", Long.toUnsignedString(user.id()));
            return;
        }

        if (capacity != UNBOUNDED && users.size() >= capacity) {
            log.warn("[USER-STORE] Rejected save of '{}': store full ({} users)", user.name(), users.size());
            throw new RepositoryException("user store full (capacity " + capacity + ")");
        }

        User stored;
        if (user.isPersisted()) {
            stored = user;
            if (Long.compareUnsigned(user.id(), lastId) > 0) {
                lastId = user.id();
            }
        } else {
            stored = user.withId(nextId());
        }
        users.put(stored.id(), stored);
        log.debug("[USER-STORE] Inserted user id={} name={}", Long.toUnsignedString(stored.id()), stored.name());
    }

    public synchronized int count() {
        return users.size();
    }

    /**
     * All stored users in insertion order.
     */
    public synchronized List<User> findAll() {
        return new ArrayList<>(users.values());
    }

    private long nextId() {
        if (lastId == -1L) {
            // -1 is the largest unsigned value
            throw new RepositoryException("user id sequence exhausted");
        }
        return ++lastId;
    }
}

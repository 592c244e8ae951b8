package in.usermgmt.application.service;

import in.usermgmt.application.port.output.RepositoryException;
import in.usermgmt.application.port.output.UserRepository;
import in.usermgmt.domain.user.User;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepo;

    @Test
    void getUser_returnsEmptyWhenRepositoryHasNothing() {
        when(userRepo.findById(anyLong())).thenReturn(Optional.empty());
        UserService service = new UserService(userRepo);

        assertTrue(service.getUser(0L).isEmpty());
        assertTrue(service.getUser(7L).isEmpty());
        assertTrue(service.getUser(Long.MAX_VALUE).isEmpty());
    }

    @Test
    void getUser_returnsRepositoryResultUnchanged() {
        User stored = new User(3L, "Dana", "dana@x.com");
        when(userRepo.findById(3L)).thenReturn(Optional.of(stored));
        UserService service = new UserService(userRepo);

        assertSame(stored, service.getUser(3L).orElseThrow());
        verify(userRepo).findById(3L);
    }

    @Test
    void createUser_savesNewUserWithoutValidation() {
        UserService service = new UserService(userRepo);

        service.createUser("Eve", "no-at-sign");

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepo).save(captor.capture());
        User saved = captor.getValue();
        assertEquals(0L, saved.id());
        assertEquals("Eve", saved.name());
        assertEquals("no-at-sign", saved.email());
    }

    @Test
    void createUser_propagatesRepositoryFailureUnchanged() {
        RepositoryException failure = new RepositoryException("disk on fire");
        doThrow(failure).when(userRepo).save(any());
        UserService service = new UserService(userRepo);

        RepositoryException thrown = assertThrows(RepositoryException.class,
            () -> service.createUser("Frank", "frank@x.com"));

        assertSame(failure, thrown);
        assertEquals("disk on fire", thrown.getMessage());
        verify(userRepo, times(1)).save(any());
    }

    @Test
    void createUser_thenFindThroughRecordingStub() {
        RecordingRepository repo = new RecordingRepository();
        UserService service = new UserService(repo);

        service.createUser("Bob", "bob@x.com");

        User found = service.getUser(0L).orElseThrow();
        assertEquals("Bob", found.name());
        assertEquals("bob@x.com", found.email());
    }

    @Test
    void constructor_rejectsNullRepository() {
        assertThrows(NullPointerException.class, () -> new UserService(null));
    }

    /**
     * Keeps saved users as-is, so lookups use the id the user was saved with.
     */
    private static final class RecordingRepository implements UserRepository {
        private final List<User> saved = new ArrayList<>();

        @Override
        public Optional<User> findById(long id) {
            return saved.stream().filter(u -> u.id() == id).findFirst();
        }

        @Override
        public void save(User user) {
            saved.add(user);
        }
    }
}

package in.usermgmt.domain.user;

/**
 * User entity.
 * Immutable: a store assigns an id by handing back a copy via {@link #withId(long)}.
 */
public record User(
    long id,          // 0 until a store assigns one
    String name,
    String email
) {
    public static final long UNASSIGNED_ID = 0L;

    /**
     * Create a new, not yet persisted user. Performs no validation.
     */
    public static User create(String name, String email) {
        return new User(UNASSIGNED_ID, name, email);
    }

    public User withId(long id) {
        return new User(id, name, email);
    }

    public boolean isPersisted() {
        return id != UNASSIGNED_ID;
    }

    /**
     * Loose email check: only looks for an '@'.
     */
    public boolean validateEmail() {
        return email != null && email.indexOf('@') >= 0;
    }
}

package tech.medops.identity.account;

/**
 * Self-service sign-up of a new facility and its owner.
 *
 * @param email optional owner email; also used as the tenant contact address
 */
public record RegistrationRequest(
    String facilityName,
    String ownerName,
    String phone,
    String password,
    String email
) {

    @Override
    public String toString() {
        return "RegistrationRequest[facilityName=" + facilityName + ", ownerName=" + ownerName + "]";
    }
}

package warden.core.model.auth;

/**
 * Attributes a principal can be looked up by in the credential store.
 */
public enum PrincipalAttribute {
    ID,
    EMAIL
}

package io.kestra.plugin.adldap;

/**
 * How the member of a group membership change is designated.
 */
public enum MemberKind {
    /** An account name. */
    USER,
    /** A group name. */
    GROUP,
    /** The DN of a contact. */
    CONTACT
}

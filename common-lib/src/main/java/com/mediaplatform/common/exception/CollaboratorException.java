package com.mediaplatform.common.exception;

/**
 * A data source the decision engine reads from could not answer. The engine turns this
 * into an {@code error} rejection whose reason starts with {@code [<collaborator code>]}.
 */
public class CollaboratorException extends RuntimeException {

    /** Read-side dependencies of a release decision. */
    public enum Collaborator {
        MEDIA_REPOSITORY("media-repository"),
        SCORING_ORACLE("scoring-oracle"),
        BLOCKLIST_STORE("blocklist-store");

        private final String code;

        Collaborator(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Collaborator collaborator;

    public CollaboratorException(Collaborator collaborator, String message) {
        super("[" + collaborator.code() + "] " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(Collaborator collaborator, String message, Throwable cause) {
        super("[" + collaborator.code() + "] " + message, cause);
        this.collaborator = collaborator;
    }

    public Collaborator getCollaborator() {
        return collaborator;
    }
}

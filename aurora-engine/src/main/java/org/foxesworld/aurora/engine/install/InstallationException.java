package org.foxesworld.aurora.engine.install;

/** The installation root is not usable as configured. */
public class InstallationException extends RuntimeException {

    public InstallationException(String message) {
        super(message);
    }

    public InstallationException(String message, Throwable cause) {
        super(message, cause);
    }
}

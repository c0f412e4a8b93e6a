package org.foxesworld.aurora.engine.game;

import org.foxesworld.aurora.engine.install.InstallationException;

import java.nio.file.Path;

/** No variant scored strictly higher than the others. */
public class UndeterminedGameException extends InstallationException {

    private final transient Path root;

    public UndeterminedGameException(Path root) {
        super("Could not determine which game is installed at " + root);
        this.root = root;
    }

    public Path root() { return root; }
}

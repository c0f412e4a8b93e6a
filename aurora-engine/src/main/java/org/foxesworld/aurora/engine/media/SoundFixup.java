package org.foxesworld.aurora.engine.media;

import org.foxesworld.aurora.core.ResourceType;

/**
 * Post-processing applied to sound bytes before they are handed out, for
 * example stripping a proprietary header. The default passes bytes through.
 */
@FunctionalInterface
public interface SoundFixup {

    SoundFixup IDENTITY = (name, type, data) -> data;

    byte[] apply(String name, ResourceType type, byte[] data);
}

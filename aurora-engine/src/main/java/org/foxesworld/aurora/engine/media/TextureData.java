package org.foxesworld.aurora.engine.media;

import org.foxesworld.aurora.core.ResourceResult;
import org.foxesworld.aurora.core.ResourceType;

import java.util.Objects;

/**
 * Raw texture bytes plus the sidecar text (TXI) that configures them.
 * Decoding the image is up to the consumer.
 */
public record TextureData(String name, ResourceResult image, String txi) {

    public TextureData {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(image, "image");
        txi = txi == null ? "" : txi;
    }

    public ResourceType format() {
        return image.type();
    }

    public byte[] bytes() {
        return image.data();
    }

    public boolean hasTxi() {
        return !txi.isEmpty();
    }
}

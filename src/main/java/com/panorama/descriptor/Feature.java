package com.panorama.descriptor;

import com.panorama.harris.Point;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public final class Feature {
    private final Point point;
    private final Descriptor descriptor;

    @Override
    public String toString() {
        return "Feature" + point;
    }
}

package com.examkit.index;

import java.util.Locale;

import com.examkit.embedding.VectorMath;

public enum DistanceMetric {
    COSINE {
        @Override
        public float distance(float[] a, float[] b) {
            return 1f - VectorMath.cosine(a, b);
        }
    },
    L2 {
        @Override
        public float distance(float[] a, float[] b) {
            return VectorMath.l2(a, b);
        }
    };

    public abstract float distance(float[] a, float[] b);

    public static DistanceMetric parse(String value) {
        if (value == null || value.isBlank()) {
            return COSINE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

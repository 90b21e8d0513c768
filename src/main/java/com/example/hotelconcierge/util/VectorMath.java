package com.example.hotelconcierge.util;

public class VectorMath {

    private VectorMath() {
    }

    /**
     * Similitud coseno. Devuelve 0 si falta algun vector, si las dimensiones no coinciden
     * o si alguna norma es cero.
     */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) return 0.0;

        double dot = 0.0, na = 0.0, nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.0;
        double score = dot / (Math.sqrt(na) * Math.sqrt(nb));
        return Double.isFinite(score) ? score : 0.0;
    }
}

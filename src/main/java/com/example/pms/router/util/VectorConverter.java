package com.example.pms.router.util;

import com.pgvector.PGvector;
import org.postgresql.util.PGobject;

import java.sql.SQLException;

/**
 * Converts embedding column values as returned by the JDBC driver into {@code float[]}.
 */
public final class VectorConverter {

    private VectorConverter() {
    }

    /**
     * @return the vector, or {@code null} when the column is null or empty
     */
    public static float[] toFloatArray(Object column) {
        if (column == null) {
            return null;
        }
        if (column instanceof PGvector vector) {
            return vector.toArray();
        }
        if (column instanceof float[] array) {
            return array.length == 0 ? null : array;
        }
        String text = column instanceof PGobject obj ? obj.getValue() : column.toString();
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            PGvector vector = new PGvector();
            vector.setValue(text.trim());
            float[] values = vector.toArray();
            return values == null || values.length == 0 ? null : values;
        } catch (SQLException e) {
            throw new IllegalArgumentException("Unable to parse embedding vector", e);
        }
    }

    public static PGvector toPgVector(float[] vector) {
        return new PGvector(vector);
    }
}

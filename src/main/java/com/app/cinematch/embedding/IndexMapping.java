package com.app.cinematch.embedding;

import com.app.cinematch.exception.InconsistentDataException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Bijection between movie ids and embedding rows. Validated on construction:
 * every row lies in [0, rowCount) and no row is claimed twice.
 */
public final class IndexMapping {

    private final Map<Long, Integer> movieToRow;
    private final Long[] rowToMovie;

    public IndexMapping(Map<Long, Integer> movieToRow, int rowCount) {
        Long[] reverse = new Long[rowCount];
        for (Map.Entry<Long, Integer> entry : movieToRow.entrySet()) {
            Long movieId = entry.getKey();
            Integer row = entry.getValue();
            if (movieId == null || row == null) {
                throw new InconsistentDataException("Null entry in embedding index");
            }
            if (row < 0 || row >= rowCount) {
                throw new InconsistentDataException(String.format(
                        "Movie %d maps to row %d outside [0, %d)", movieId, row, rowCount));
            }
            if (reverse[row] != null) {
                throw new InconsistentDataException(String.format(
                        "Movies %d and %d both map to row %d", reverse[row], movieId, row));
            }
            reverse[row] = movieId;
        }
        this.movieToRow = Collections.unmodifiableMap(new HashMap<>(movieToRow));
        this.rowToMovie = reverse;
    }

    public OptionalInt rowOf(long movieId) {
        Integer row = movieToRow.get(movieId);
        return row == null ? OptionalInt.empty() : OptionalInt.of(row);
    }

    public boolean isEmbedded(long movieId) {
        return movieToRow.containsKey(movieId);
    }

    public Optional<Long> movieAt(int row) {
        if (row < 0 || row >= rowToMovie.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(rowToMovie[row]);
    }

    public int size() {
        return movieToRow.size();
    }

    public int rowCount() {
        return rowToMovie.length;
    }
}

package com.plyoox.stream.notifier.model.twitch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Helix envelope: {@code {"data": [...], "pagination": {"cursor": "..."}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwitchDataResponse<T> {
    List<T> data = new ArrayList<>();
    @Nullable
    Pagination pagination;

    public static <T> TwitchDataResponse<T> of(List<T> data) {
        return new TwitchDataResponse<>(new ArrayList<>(data), null);
    }

    /**
     * Helix may answer with {@code "data": null}, read as no rows.
     */
    @Nonnull
    public List<T> getData() {
        return data == null ? Collections.emptyList() : data;
    }

    public Optional<T> first() {
        List<T> rows = getData();
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    public Optional<String> nextCursor() {
        return Optional.ofNullable(pagination)
                .map(Pagination::getCursor)
                .filter(cursor -> !cursor.isEmpty());
    }
}

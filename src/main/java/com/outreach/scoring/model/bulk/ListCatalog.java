package com.outreach.scoring.model.bulk;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Whole content of the list store: {@code {"lists": [...]}} plus any other top-level keys.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListCatalog {

    private List<ListEntry> lists = new ArrayList<>();

    @Setter(AccessLevel.NONE)
    private Map<String, Object> extra = new LinkedHashMap<>();

    public ListCatalog(List<ListEntry> lists) {
        this.lists = lists;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    public Optional<ListEntry> find(String filename) {
        return lists.stream().filter(e -> filename.equals(e.getFilename())).findFirst();
    }
}

package com.sysmuse.calc;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Saved calculator state: the cells in order and which one had focus.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionSnapshot {

    @JsonProperty("activeIndex")
    private int activeIndex;

    @JsonProperty("cells")
    private List<CellRecord> cells = new ArrayList<>();

    public SessionSnapshot() {
    }

    public SessionSnapshot(int activeIndex, List<CellRecord> cells) {
        this.activeIndex = activeIndex;
        this.cells = new ArrayList<>(cells);
    }

    public static SessionSnapshot empty() {
        return new SessionSnapshot();
    }

    public int getActiveIndex() { return activeIndex; }
    public void setActiveIndex(int activeIndex) { this.activeIndex = activeIndex; }

    public List<CellRecord> getCells() { return cells == null ? new ArrayList<>() : cells; }
    public void setCells(List<CellRecord> cells) { this.cells = cells; }

    @JsonIgnore
    public boolean isEmpty() {
        return getCells().isEmpty();
    }
}

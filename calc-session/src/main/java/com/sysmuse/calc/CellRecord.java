package com.sysmuse.calc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted form of a cell. The expression is the node tree as a JSON string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CellRecord {

    @JsonProperty("index")
    private int index;

    @JsonProperty("expression")
    private String expression = "";

    @JsonProperty("answer")
    private String answer = "";

    public CellRecord() {
    }

    public CellRecord(int index, String expression, String answer) {
        this.index = index;
        this.expression = expression;
        this.answer = answer;
    }

    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }

    public String getExpression() { return expression == null ? "" : expression; }
    public void setExpression(String expression) { this.expression = expression; }

    public String getAnswer() { return answer == null ? "" : answer; }
    public void setAnswer(String answer) { this.answer = answer; }
}

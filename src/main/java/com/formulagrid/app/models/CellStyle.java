package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Display attributes of a cell. Opaque to the engine; it only gets moved around
 * by structural edits.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellStyle {
    private String background;
    private String foreground;
    private String alignment;
    private Boolean bold;
    private Boolean italic;

    // Default constructor needed for JSON (de)serialization
    public CellStyle() {
    }

    public CellStyle(String background, String foreground, String alignment, Boolean bold, Boolean italic) {
        this.background = background;
        this.foreground = foreground;
        this.alignment = alignment;
        this.bold = bold;
        this.italic = italic;
    }

    public static CellStyle background(String color) {
        return new CellStyle(color, null, null, null, null);
    }

    public String getBackground() {
        return background;
    }
    public String getForeground() {
        return foreground;
    }
    public String getAlignment() {
        return alignment;
    }
    public Boolean getBold() {
        return bold;
    }
    public Boolean getItalic() {
        return italic;
    }
    public void setBackground(String background) {
        this.background = background;
    }
    public void setForeground(String foreground) {
        this.foreground = foreground;
    }
    public void setAlignment(String alignment) {
        this.alignment = alignment;
    }
    public void setBold(Boolean bold) {
        this.bold = bold;
    }
    public void setItalic(Boolean italic) {
        this.italic = italic;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellStyle)) {
            return false;
        }
        CellStyle that = (CellStyle) o;
        return Objects.equals(background, that.background)
                && Objects.equals(foreground, that.foreground)
                && Objects.equals(alignment, that.alignment)
                && Objects.equals(bold, that.bold)
                && Objects.equals(italic, that.italic);
    }

    @Override
    public int hashCode() {
        return Objects.hash(background, foreground, alignment, bold, italic);
    }

    @Override
    public String toString() {
        return "CellStyle{bg=" + background + ", fg=" + foreground + ", align=" + alignment
                + ", bold=" + bold + ", italic=" + italic + "}";
    }
}

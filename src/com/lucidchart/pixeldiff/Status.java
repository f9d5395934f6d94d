package com.lucidchart.pixeldiff;

import java.awt.*;

/** Possible tags for a pixel comparison */
public enum Status {

    IDENTICAL ("Identical", Color.GREEN),
    PASSED ("Passed", Color.GREEN),
    FAILED ("Failed", Color.RED);

    public final Color tagColor;
    public final String text;

    Status(String text, Color tagColor) {
        this.text = text;
        this.tagColor = tagColor;
    }

    /** Byte equal images are IDENTICAL, images without counted differences PASSED, anything else FAILED */
    static Status of(ComparisonResult result) {
        if (result.isIdentical()) return IDENTICAL;
        return result.getDiffCount() == 0 ? PASSED : FAILED;
    }
}

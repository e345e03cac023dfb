package com.novaware.catalog.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextUtilsTest {

    @Test
    public void stripsTrailingDashAndSpaces() {
        assertEquals("Classic Cotton Tee White", TextUtils.sanitizeTitle("Classic Cotton Tee White —  "));
    }

    @Test
    public void stripsLeadingSeparators() {
        assertEquals("Slim Fit Jeans", TextUtils.sanitizeTitle(" —  |  :  Slim Fit Jeans"));
    }

    @Test
    public void collapsesSpacesAndKeepsMiddleDashes() {
        assertEquals("Linen Shirt – Navy", TextUtils.sanitizeTitle("Linen  Shirt  –  Navy"));
    }

    @Test
    public void emptyAfterCleanFallsBackToTrimmedOriginal() {
        assertEquals("—", TextUtils.sanitizeTitle("   —  "));
    }

    @Test
    public void nullTitleStaysNull() {
        assertNull(TextUtils.sanitizeTitle(null));
    }

    @Test
    public void joinsParagraphsWithoutMarkup() {
        String joined = TextUtils.joinParagraphs(List.of("<p>Soft <b>cotton</b></p>", "  ", "Machine washable"));
        assertEquals("Soft cotton\nMachine washable", joined);
    }

    @Test
    public void paragraphsWithoutTextJoinToNull() {
        assertNull(TextUtils.joinParagraphs(List.of("", "<br/>")));
        assertNull(TextUtils.joinParagraphs(null));
    }
}

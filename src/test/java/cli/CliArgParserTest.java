package cli;

import domain.format.IndentStyle;
import domain.format.KeywordCase;
import domain.format.SqlDialect;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @AfterEach
    void clearProps() {
        System.clearProperty("keywordCase");
        System.clearProperty("useTabs");
    }

    @Test
    void parseArgs_supportsEqualsAndSpaceForms() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{
                "--in=mappers", "--out", "target/out", "--inPlace", "--dialect=postgres", "positional"
        });

        assertEquals("mappers", m.get("in"));
        assertEquals("target/out", m.get("out"));
        assertEquals("", m.get("inPlace"));
        assertEquals("postgres", m.get("dialect"));
        assertEquals(4, m.size());
    }

    @Test
    void flag_presenceStyle() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--inPlace", "--failFast=false", "--useTabs=yes"});

        assertTrue(CliArgParser.flag(m, "inPlace"));
        assertFalse(CliArgParser.flag(m, "failFast"));
        assertTrue(CliArgParser.flag(m, "useTabs"));
        assertFalse(CliArgParser.flag(m, "noResult"));
    }

    @Test
    void option_fallsBackToSystemProperty_commandLineWins() {
        System.setProperty("keywordCase", "lower");
        System.setProperty("useTabs", "true");

        assertEquals("lower", CliArgParser.option(Map.of(), "keywordCase"));
        assertEquals("preserve", CliArgParser.option(Map.of("keywordCase", "preserve"), "keywordCase"));
        assertTrue(CliArgParser.optionFlag(Map.of(), "useTabs"));
        assertFalse(CliArgParser.optionFlag(Map.of("useTabs", "false"), "useTabs"));
        assertNull(CliArgParser.option(Map.of(), "tabWidth"));
    }

    @Test
    void formattingOptions() {
        assertTrue(CliArgParser.isAutoDialect(null));
        assertTrue(CliArgParser.isAutoDialect("AUTO"));
        assertNull(CliArgParser.parseDialect("auto"));
        assertEquals(SqlDialect.POSTGRESQL, CliArgParser.parseDialect("pg"));
        assertEquals(KeywordCase.LOWER, CliArgParser.parseKeywordCase("lower"));
        assertEquals(IndentStyle.TABULAR_LEFT, CliArgParser.parseIndentStyle("tabularLeft"));
        assertEquals(Integer.valueOf(2), CliArgParser.parseTabWidth("2"));
        assertNull(CliArgParser.parseTabWidth("0"));
        assertNull(CliArgParser.parseTabWidth("abc"));
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parseKeywordCase("camel"));
    }
}

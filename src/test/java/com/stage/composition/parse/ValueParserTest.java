package com.stage.composition.parse;

import com.stage.composition.core.model.PropertyValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueParserTest {

    @Test
    @DisplayName("Should parse color triples")
    void testColor() {
        assertEquals(new PropertyValue.ColorValue(0.2, 0.4, 1),
                ValueParser.parse("color3f[]", "[(0.2, 0.4, 1.0)]"));
        assertEquals(new PropertyValue.StringValue("red"), ValueParser.parse("color3f", "red"));
    }

    @Test
    @DisplayName("Should parse numbers by declared type")
    void testNumbers() {
        assertEquals(new PropertyValue.NumberValue(3), ValueParser.parse("int", "3"));
        assertEquals(new PropertyValue.NumberValue(-1.5e2), ValueParser.parse("double", "-1.5e2"));
        assertEquals(new PropertyValue.StringValue("abc"), ValueParser.parse("float", "abc"));
    }

    @Test
    @DisplayName("Should parse booleans")
    void testBooleans() {
        assertEquals(new PropertyValue.BoolValue(true), ValueParser.parse("bool", "1"));
        assertEquals(new PropertyValue.BoolValue(false), ValueParser.parse("bool", "False"));
    }

    @Test
    @DisplayName("Should unquote strings and tokens")
    void testStrings() {
        assertEquals(new PropertyValue.StringValue("a \"b\""), ValueParser.parse("string", "\"a \\\"b\\\"\""));
        assertEquals(new PropertyValue.StringValue("Shared"), ValueParser.parse("token", "'Shared'"));
        assertEquals(new PropertyValue.StringValue("tex.png"), ValueParser.parse("asset", "@tex.png@"));
    }

    @Test
    @DisplayName("Should parse string arrays")
    void testStringArray() {
        assertEquals(new PropertyValue.StringArrayValue(List.of("/A", "/B")),
                ValueParser.parse("string[]", "[\"/A\", \"/B\"]"));
        assertEquals(new PropertyValue.StringArrayValue(List.of()), ValueParser.parse("token[]", "[]"));
    }

    @Test
    @DisplayName("Should infer untyped values")
    void testUntyped() {
        assertEquals(new PropertyValue.StringValue("x"), ValueParser.parse(null, "\"x\""));
        assertEquals(new PropertyValue.NumberValue(2), ValueParser.parse(null, "2"));
        assertEquals(new PropertyValue.StringValue("bare"), ValueParser.parse(null, "bare"));
    }

    @Test
    @DisplayName("Should escape quotes and backslashes")
    void testEscape() {
        assertEquals("a\\\"b\\\\c", ValueParser.escape("a\"b\\c"));
        assertEquals("a\"b\\c", ValueParser.unquote("\"a\\\"b\\\\c\""));
    }
}

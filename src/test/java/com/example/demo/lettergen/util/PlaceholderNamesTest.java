package com.example.demo.lettergen.util;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PlaceholderNamesTest {

    private PlaceholderNames names() {
        Map<String, String> aliases = new HashMap<>();
        aliases.put("comision", "comision");
        aliases.put("Órgano", "organo");
        return new PlaceholderNames(aliases);
    }

    @Test
    public void testAccentAndCaseVariantsResolveToAlias() {
        PlaceholderNames names = names();

        assertEquals("comision", names.normalize("Comisión"));
        assertEquals("comision", names.normalize("comisión"));
        assertEquals("organo", names.normalize(" órgano "));
        assertEquals("organo", names.normalize("ORGANO"));
    }

    @Test
    public void testNamesWithoutAliasAreTrimmed() {
        PlaceholderNames names = names();

        assertEquals("Nombre_Cliente", names.normalize(" Nombre_Cliente "));
        assertNull(names.normalize(null));
    }

    @Test
    public void testFold() {
        assertEquals("malaga", PlaceholderNames.fold("MÁLAGA"));
        assertEquals("diputacio", PlaceholderNames.fold("Diputació"));
    }

    @Test
    public void testNullAliases() {
        assertEquals("x", new PlaceholderNames(null).normalize("x"));
    }
}

package com.example.demo.lettergen.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Office {
    private String name;
    private String address;
    private String postalCode;
    private String city;

    /**
     * The template variables this office provides.
     */
    public Map<String, String> toVariables() {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("Direccion_Oficina", address == null ? "" : address);
        vars.put("CP", postalCode == null ? "" : postalCode);
        vars.put("Ciudad_Oficina", city == null ? "" : city);
        return vars;
    }
}

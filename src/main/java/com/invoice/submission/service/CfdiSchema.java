package com.invoice.submission.service;

import java.util.List;

/**
 * Known CFDI schema versions, newest first. Each version lists every namespace URI
 * seen in the wild, including the misspelled {@code gobmx} host.
 * Adding a version means adding a constant here; detection walks the list in order.
 */
public enum CfdiSchema {

    V4_0("4.0", List.of(
            "http://www.sat.gob.mx/cfd/4",
            "http://www.sat.gobmx/cfd/4")),

    V3_3("3.3", List.of(
            "http://www.sat.gob.mx/cfd/3",
            "http://www.sat.gobmx/cfd/3"));

    public static final String STAMP_NAMESPACE = "http://www.sat.gob.mx/TimbreFiscalDigital";

    private final String version;
    private final List<String> namespaces;

    CfdiSchema(String version, List<String> namespaces) {
        this.version = version;
        this.namespaces = namespaces;
    }

    public String getVersion() {
        return version;
    }

    public List<String> getNamespaces() {
        return namespaces;
    }

    public boolean declares(String text) {
        if (text == null || text.isEmpty()) return false;
        for (String ns : namespaces) {
            if (text.contains(ns)) return true;
        }
        return false;
    }

    /** Oldest known version, used when nothing newer is declared. */
    public static CfdiSchema fallback() {
        CfdiSchema[] all = values();
        return all[all.length - 1];
    }
}

package org.dxworks.docframe.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ExtractionResult {
    public String kind = "document";
    public String filePath;
    public String mode; // warehouse or legacy
    public Map<String, Object> structure = new LinkedHashMap<>();
    public List<Diagnostic> diagnostics = new ArrayList<>();

    public Object category(String name) {
        return structure.get(name);
    }
}

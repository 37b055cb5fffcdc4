package org.dxworks.docframe.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Frontmatter {
    public Map<String, Object> data = new LinkedHashMap<>(); // single value -> String, otherwise List<String>
    public List<String> keys = new ArrayList<>();
    public Integer startLine;
    public Integer endLine;

    public void put(String key, List<String> values) {
        if (!data.containsKey(key)) {
            keys.add(key);
        }
        data.put(key, values.size() == 1 ? values.get(0) : new ArrayList<>(values));
    }
}

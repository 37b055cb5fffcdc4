package org.dxworks.docframe.parity;

import java.util.List;

public class ParityReport {
    public String filePath;
    public List<String> mismatchedCategories;
    public int warehouseDiagnostics;
    public int legacyDiagnostics;

    public boolean isIdentical() {
        return mismatchedCategories.isEmpty();
    }
}

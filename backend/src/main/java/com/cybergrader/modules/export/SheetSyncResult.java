package com.cybergrader.modules.export;

import java.util.List;

public record SheetSyncResult(String status,
                              String spreadsheetId,
                              List<String> updatedRanges,
                              int rowsWritten,
                              String message) {

    public static SheetSyncResult skipped(String message) {
        return new SheetSyncResult("skipped", null, List.of(), 0, message);
    }
}

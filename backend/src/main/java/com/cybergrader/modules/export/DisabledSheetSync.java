package com.cybergrader.modules.export;

import com.cybergrader.modules.store.ExportResponse;

public class DisabledSheetSync implements SheetSync {

    @Override
    public SheetSyncResult push(ExportResponse export) {
        return SheetSyncResult.skipped("spreadsheet sync is not configured");
    }
}

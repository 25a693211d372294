package com.cybergrader.modules.export;

import com.cybergrader.modules.store.ExportResponse;

/** Pushes the score export to an external spreadsheet. Never throws. */
public interface SheetSync {

    SheetSyncResult push(ExportResponse export);
}

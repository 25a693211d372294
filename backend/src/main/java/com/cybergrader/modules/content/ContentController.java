package com.cybergrader.modules.content;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Content", description = "Content sync and course notes")
public class ContentController {

    private final ContentSyncService syncService;
    private final NoteService noteService;

    @PostMapping("/admin/sync")
    @Operation(summary = "Refresh the content repository and reload every definition")
    public ResponseEntity<SyncResponse> sync() {
        return ResponseEntity.ok(syncService.refreshAndSync());
    }

    @GetMapping("/notes/{name}")
    @Operation(summary = "Read a markdown note")
    public ResponseEntity<Note> note(@PathVariable String name) {
        return ResponseEntity.ok(noteService.read(name));
    }
}

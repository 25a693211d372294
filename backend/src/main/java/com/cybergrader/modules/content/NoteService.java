package com.cybergrader.modules.content;

import com.cybergrader.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/** Serves {@code notes/<name>.md} from the current content root. */
@Slf4j
@Service
@RequiredArgsConstructor
public class NoteService {

    private final ContentWorkspace workspace;

    public Note read(String name) {
        Path notes = workspace.root().resolve("notes").toAbsolutePath().normalize();
        Path file;
        try {
            file = notes.resolve(name + ".md").normalize();
        } catch (InvalidPathException e) {
            throw new ResourceNotFoundException("Note", name);
        }
        if (!file.getParent().equals(notes) || !Files.isRegularFile(file)) {
            throw new ResourceNotFoundException("Note", name);
        }
        try {
            return new Note(name, Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read note " + name, e);
        }
    }
}

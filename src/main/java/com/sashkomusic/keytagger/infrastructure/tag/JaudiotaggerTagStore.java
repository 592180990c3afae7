package com.sashkomusic.keytagger.infrastructure.tag;

import com.sashkomusic.keytagger.domain.port.TagStorePort;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

@Slf4j
@Service
public class JaudiotaggerTagStore implements TagStorePort {

    @Override
    public boolean writeTitle(Path audioFile, String title) {
        try {
            AudioFile f = AudioFileIO.read(audioFile.toFile());
            Tag tag = f.getTagOrCreateAndSetDefault();

            String existingTitle = tag.getFirst(FieldKey.TITLE);
            log.debug("Replacing title '{}' with '{}' in {}", existingTitle, title, audioFile.getFileName());

            tag.setField(FieldKey.TITLE, title);
            f.commit();
            return true;

        } catch (CannotReadException ex) {
            log.warn("Format not supported for metadata: {}", audioFile.getFileName());
            return false;
        } catch (Exception ex) {
            log.error("Error updating metadata for {}: {}", audioFile.getFileName(), ex.getMessage());
            return false;
        }
    }
}

package com.phillippitts.consulttranslator.service.recording;

import java.nio.file.Path;
import java.util.List;

/**
 * Files written for one saved conversation.
 *
 * @param original  bilingual transcript with all entries
 * @param primary   primary party's view
 * @param secondary secondary party's view
 */
public record RecordedConversation(Path original, Path primary, Path secondary) {

    public List<Path> files() {
        return List.of(original, primary, secondary);
    }
}

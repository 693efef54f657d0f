package uk.gegc.coursemaker.features.generation.application.output;

import java.util.List;

/**
 * Model output for a course outline: sections holding ordered lessons.
 */
public record OutlineDraft(List<Section> sections) {

    public record Section(String title, List<Lesson> lessons) {
    }

    public record Lesson(String title, String summary) {
    }

    public int lessonCount() {
        if (sections == null) {
            return 0;
        }
        return sections.stream()
                .mapToInt(section -> section.lessons() == null ? 0 : section.lessons().size())
                .sum();
    }
}

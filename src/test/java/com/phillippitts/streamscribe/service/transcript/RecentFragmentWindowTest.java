package com.phillippitts.streamscribe.service.transcript;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecentFragmentWindowTest {

    @Test
    void evictsOldestWhenFull() {
        RecentFragmentWindow window = new RecentFragmentWindow(2);

        window.add("one");
        window.add("two");
        window.add("three");

        assertThat(window.snapshot()).containsExactly("two", "three");
        assertThat(window.size()).isEqualTo(2);
    }

    @Test
    void maxSimilarityChecksEveryEntry() {
        RecentFragmentWindow window = new RecentFragmentWindow(3);
        window.add("good morning everyone");
        window.add("let's get started");

        assertThat(window.maxSimilarity("Good morning everyone")).isEqualTo(1.0);
        assertThat(window.maxSimilarity("completely different words")).isLessThan(0.5);
    }

    @Test
    void emptyWindowScoresZero() {
        assertThat(new RecentFragmentWindow(1).maxSimilarity("anything")).isZero();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new RecentFragmentWindow(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package io.dumpclean.wikidump;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LinkPlaceholdersTest {

    @Test
    void hides_and_restores_link_brackets() {
        String hidden = LinkPlaceholders.protect("See [[Dog]] and [[Cat|cats]].");
        assertEquals("See <SPEC_START>Dog<SPEC_END> and <SPEC_START>Cat|cats<SPEC_END>.", hidden);
        assertEquals("See [[Dog]] and [[Cat|cats]].", LinkPlaceholders.restore(hidden));
    }

    @Test
    void single_brackets_are_left_alone() {
        assertEquals("[http://x y] [a]", LinkPlaceholders.protect("[http://x y] [a]"));
    }

    @Test
    void literal_placeholders_in_the_input_come_back_as_brackets() {
        String text = "raw <SPEC_START> marker";
        assertEquals("raw [[ marker", LinkPlaceholders.restore(LinkPlaceholders.protect(text)));
    }
}

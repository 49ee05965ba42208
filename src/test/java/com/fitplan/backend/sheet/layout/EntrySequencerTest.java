package com.fitplan.backend.sheet.layout;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EntrySequencerTest {

    private static List<Long> ids(Long... v) {
        return List.of(v);
    }

    private static List<Long> flatten(List<Block> blocks) {
        List<Long> out = new ArrayList<>();
        blocks.forEach(b -> out.addAll(b.members()));
        return out;
    }

    @Test
    void partner_is_pulled_forward_next_to_its_primary() {
        AdjacencyMap pairs = PairingResolver.resolve(List.of(List.of(2L, 4L)));

        List<Block> blocks = EntrySequencer.sequence(ids(1L, 2L, 3L, 4L), pairs);

        assertThat(blocks).containsExactly(
                Block.single(1L),
                new Block(2L, List.of(4L)),
                Block.single(3L)
        );
        assertThat(flatten(blocks)).containsExactly(1L, 2L, 4L, 3L);
    }

    @Test
    void block_is_anchored_at_first_encountered_member() {
        AdjacencyMap pairs = PairingResolver.resolve(List.of(List.of(4L, 2L)));

        List<Block> blocks = EntrySequencer.sequence(ids(4L, 1L, 2L), pairs);

        assertThat(blocks).containsExactly(new Block(4L, List.of(2L)), Block.single(1L));
    }

    @Test
    void partners_not_in_workout_are_ignored() {
        AdjacencyMap pairs = PairingResolver.resolve(List.of(List.of(1L, 42L)));

        List<Block> blocks = EntrySequencer.sequence(ids(1L, 2L), pairs);

        assertThat(blocks).containsExactly(Block.single(1L), Block.single(2L));
    }

    @Test
    void only_direct_partners_are_expanded() {
        // 1-2, 2-3：3 不是 1 的直接夥伴，不會被拉進第一個 block
        AdjacencyMap pairs = PairingResolver.resolve(List.of(List.of(1L, 2L), List.of(2L, 3L)));

        List<Block> blocks = EntrySequencer.sequence(ids(1L, 5L, 2L, 3L), pairs);

        assertThat(blocks).containsExactly(
                new Block(1L, List.of(2L)),
                Block.single(5L),
                Block.single(3L)
        );
    }

    @Test
    void primary_with_several_partners_keeps_adjacency_order() {
        AdjacencyMap pairs = PairingResolver.resolve(List.of(List.of(1L, 4L), List.of(1L, 2L)));

        List<Block> blocks = EntrySequencer.sequence(ids(1L, 2L, 3L, 4L), pairs);

        assertThat(blocks).containsExactly(new Block(1L, List.of(4L, 2L)), Block.single(3L));
    }

    @Test
    void output_is_a_partition_of_the_exercise_list() {
        List<Long> workout = ids(8L, 3L, 5L, 1L, 9L, 2L, 7L);
        AdjacencyMap pairs = PairingResolver.resolve(List.of(
                List.of(3L, 7L), List.of(5L, 2L), List.of(2L, 9L), List.of(1L, 8L), List.of(9L, 100L)
        ));

        List<Long> flat = flatten(EntrySequencer.sequence(workout, pairs));

        assertThat(flat).hasSameSizeAs(workout).containsExactlyInAnyOrderElementsOf(workout);
    }

    @Test
    void duplicate_ids_are_emitted_once() {
        List<Block> blocks = EntrySequencer.sequence(ids(1L, 2L, 1L), AdjacencyMap.empty());

        assertThat(flatten(blocks)).containsExactly(1L, 2L);
    }

    @Test
    void empty_workout_gives_no_blocks() {
        assertThat(EntrySequencer.sequence(List.of(), AdjacencyMap.empty())).isEmpty();
        assertThat(EntrySequencer.sequence(null, null)).isEmpty();
    }
}

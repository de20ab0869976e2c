package io.layermesh.layer;

import io.layermesh.model.ModelClass;
import io.layermesh.model.Registerable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

final class LayerForkTest {

    @Test
    void forkMaterializesItsOwnCopyOnFirstAccess() {
        Layer layer = Layer.builder()
                .name("backend")
                .register("Movie", new ModelClass().setField("genre", "drama"))
                .build();
        Registerable original = layer.get("Movie");

        Layer fork = layer.fork();
        Registerable copy = fork.get("Movie");

        Assertions.assertNotSame(original, copy);
        Assertions.assertSame(copy, fork.get("Movie"));
        Assertions.assertEquals(original.getField("genre"), copy.getField("genre"));
        Assertions.assertEquals("Movie", copy.getRegisteredName());
        Assertions.assertSame(fork, copy.getLayer());
        Assertions.assertSame(layer, original.getLayer());
        Assertions.assertEquals("backend", fork.getName());
    }

    @Test
    void writesOnAForkNeverReachTheOriginal() {
        ModelClass movie = new ModelClass().setField("genre", "drama");
        Layer layer = Layer.builder().register("Movie", movie).build();
        Layer fork = layer.fork();

        fork.get("Movie").setField("genre", "comedy");
        fork.register("Actor", new ModelClass());

        Assertions.assertEquals(Optional.of("comedy"), fork.get("Movie").getField("genre"));
        Assertions.assertEquals(Optional.of("drama"), layer.get("Movie").getField("genre"));
        Assertions.assertNull(layer.get("Actor", false));
        Assertions.assertSame(movie, layer.get("Movie"));
    }

    @Test
    void itemsAreListedOldestLayerFirst() {
        Layer layer = Layer.builder()
                .register("Movie", new ModelClass())
                .register("Actor", new ModelClass())
                .build();
        Layer fork = layer.fork();
        fork.register("Studio", new ModelClass());
        fork.get("Actor");

        Assertions.assertEquals(List.of("Movie", "Actor", "Studio"), names(fork.getItems()));
        Assertions.assertEquals(List.of("Movie", "Actor"), names(layer.getItems()));
        Assertions.assertEquals(List.of("Studio"), names(fork.getItems(item -> item.getRegisteredName().startsWith("S"))));
    }

    @Test
    void forksOfForksReadThroughTheWholeChain() {
        Layer layer = Layer.builder().register("Movie", new ModelClass().setField("genre", "drama")).build();
        Layer middle = layer.fork();
        Layer leaf = middle.fork();

        Registerable leafMovie = leaf.get("Movie");

        Assertions.assertEquals(Optional.of("drama"), leafMovie.getField("genre"));
        Assertions.assertSame(layer.get("Movie"), leafMovie.getBase().orElseThrow());
    }

    @Test
    void ghostIsAMemoizedFork() {
        Layer layer = Layer.builder().register("Movie", new ModelClass()).build();
        Layer ghost = layer.getGhost();

        Assertions.assertSame(ghost, layer.getGhost());
        Assertions.assertSame(layer, ghost.getBase().orElseThrow());
        Assertions.assertNotSame(layer.get("Movie"), ghost.get("Movie"));
    }

    @Test
    void detachOnlyTouchesOwnItemsAndPropagatesToLaterForks() {
        Layer layer = Layer.builder()
                .register("Movie", new ModelClass())
                .register("Actor", new ModelClass())
                .build();
        Layer fork = layer.fork();
        Registerable movie = fork.get("Movie");

        fork.detach();

        Assertions.assertTrue(fork.isDetached());
        Assertions.assertTrue(movie.isDetached());
        Assertions.assertFalse(layer.isDetached());
        Assertions.assertFalse(layer.get("Actor").isDetached());
        Assertions.assertTrue(fork.get("Actor").isDetached());
        Assertions.assertTrue(fork.fork().isDetached());
    }

    private static List<String> names(List<Registerable> items) {
        List<String> names = new ArrayList<>();
        for (Registerable item : items) {
            names.add(item.getRegisteredName());
        }
        return names;
    }
}

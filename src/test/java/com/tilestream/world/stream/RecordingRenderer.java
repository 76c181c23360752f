package com.tilestream.world.stream;

import com.tilestream.render.ChunkRenderer;
import com.tilestream.world.ChunkData;
import com.tilestream.world.gen.GenConfig;

import java.util.ArrayList;
import java.util.List;

class RecordingRenderer implements ChunkRenderer {

    final List<ChunkData> applied = new ArrayList<>();
    final List<GenConfig> configs = new ArrayList<>();
    int clears;

    @Override
    public void apply(ChunkData chunk) {
        applied.add(chunk);
    }

    @Override
    public void clear() {
        clears++;
    }

    @Override
    public void configure(GenConfig config) {
        configs.add(config);
    }
}

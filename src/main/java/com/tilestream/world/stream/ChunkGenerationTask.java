package com.tilestream.world.stream;

import com.tilestream.world.ChunkCoordinate;
import com.tilestream.world.ChunkData;

import java.util.Queue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Generates one chunk off the scheduling thread. Touches no scheduler state:
 * its only side effect is exactly one deposit, into the completed queue on
 * success or the failed queue otherwise. Anything the generator throws,
 * errors included, becomes a failure result; fatal VM errors are rethrown
 * after the deposit.
 */
public class ChunkGenerationTask implements Runnable {

    private static final Logger LOG = Logger.getLogger(ChunkGenerationTask.class.getName());

    private final ChunkCoordinate coord;
    private final long ticket;
    private final ChunkGenerator generator;
    private final Queue<GenerationResult> completedQueue;
    private final Queue<GenerationResult> failedQueue;

    public ChunkGenerationTask(ChunkCoordinate coord, long ticket, ChunkGenerator generator,
                               Queue<GenerationResult> completedQueue,
                               Queue<GenerationResult> failedQueue) {
        this.coord = coord;
        this.ticket = ticket;
        this.generator = generator;
        this.completedQueue = completedQueue;
        this.failedQueue = failedQueue;
    }

    @Override
    public void run() {
        ChunkData data;
        try {
            data = generator.generate(coord);
            if (data == null) {
                throw new IllegalStateException("Generator returned no data");
            }
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "Failed to generate chunk " + coord, t);
            failedQueue.add(GenerationResult.failure(coord, ticket, t));
            if (t instanceof VirtualMachineError fatal) {
                throw fatal;
            }
            return;
        }
        completedQueue.add(GenerationResult.success(coord, ticket, data));
    }

    public ChunkCoordinate getCoord() { return coord; }
    public long getTicket() { return ticket; }
}

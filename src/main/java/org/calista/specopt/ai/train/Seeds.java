package org.calista.specopt.ai.train;

/**
 * Per-(seed, update, stream) RNG seeds. A resumed run derives exactly the seeds the
 * uninterrupted run would have used, so no RNG state is checkpointed.
 */
final class Seeds {

    /** Stream id of the minibatch shuffle; env streams use their slot index. */
    static final int SHUFFLE_STREAM = -1;

    private Seeds() {
    }

    static long derive(long seed, int update, int stream) {
        long x = mix64(seed ^ 0x9E3779B97F4A7C15L);
        x = mix64(x ^ (((long) update) * 0xBF58476D1CE4E5B9L));
        return mix64(x ^ (((long) stream) * 0x94D049BB133111EBL));
    }

    static long mix64(long x) {
        x ^= (x >>> 33);
        x *= 0xff51afd7ed558ccdL;
        x ^= (x >>> 33);
        x *= 0xc4ceb9fe1a85ec53L;
        x ^= (x >>> 33);
        return x;
    }
}

/*
 * Copyright © 2011-2024 Chris Vest (mr.chrisvest@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package slotpool.tests.blackbox;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import slotpool.PoolError;
import slotpool.Result;
import slotpool.SlotPool;
import testkits.Color;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives pools through random operation sequences, checking the pool against a
 * plain array of flags after every step.
 */
class PoolInvariantsTest {
  static LongStream seeds() {
    return LongStream.range(0, 40);
  }

  @ParameterizedTest
  @MethodSource("seeds")
  void randomOperationsMustKeepPoolConsistent(long seed) {
    SplittableRandom rng = new SplittableRandom(seed);
    int capacity = rng.nextInt(0, 17);
    SlotPool<Color> pool = SlotPool.of(capacity, Color::new);
    boolean[] reference = new boolean[capacity];

    for (int step = 0; step < 500; step++) {
      int index = rng.nextInt(-1, capacity + 2);
      boolean inRange = index >= 0 && index < capacity;
      boolean wasActive = inRange && reference[index];
      switch (rng.nextInt(6)) {
        case 0 -> {
          Result<Color> result = pool.use(index);
          if (!inRange) {
            assertEquals(PoolError.OUT_OF_RANGE, result.error());
          } else if (wasActive) {
            assertEquals(PoolError.ALREADY_IN_USE, result.error());
          } else {
            assertTrue(result.isSuccess());
            reference[index] = true;
          }
        }
        case 1, 2 -> {
          Result<Color> result = pool.useNext();
          if (countActive(reference) == capacity) {
            assertEquals(PoolError.FULL, result.error());
          } else {
            assertTrue(result.isSuccess());
            assertFalse(reference[result.index()]);
            reference[result.index()] = true;
          }
        }
        case 3 -> {
          Result<Void> result = pool.unUse(index);
          if (!inRange) {
            assertEquals(PoolError.OUT_OF_RANGE, result.error());
          } else if (!wasActive) {
            assertEquals(PoolError.ALREADY_UNUSED, result.error());
          } else {
            assertTrue(result.isSuccess());
            reference[index] = false;
          }
        }
        case 4 -> {
          Result<Void> result = pool.replace(index);
          if (!inRange) {
            assertEquals(PoolError.OUT_OF_RANGE, result.error());
          } else {
            assertTrue(result.isSuccess());
            reference[index] = false;
          }
        }
        default -> {
          Result<Color> result = pool.get(index);
          if (!inRange) {
            assertEquals(PoolError.OUT_OF_RANGE, result.error());
          } else if (!wasActive) {
            assertEquals(PoolError.NOT_IN_USE, result.error());
          } else {
            assertTrue(result.isSuccess());
          }
        }
      }
      assertMatchesReference(pool, reference);
    }
  }

  private static void assertMatchesReference(SlotPool<Color> pool, boolean[] reference) {
    assertEquals(reference.length, pool.size());
    List<Integer> expectedIndexes = new ArrayList<>();
    for (int i = 0; i < reference.length; i++) {
      assertEquals(reference[i], pool.isInUse(i));
      if (reference[i]) {
        expectedIndexes.add(i);
      }
    }
    assertFalse(pool.isInUse(reference.length));
    assertEquals(expectedIndexes.size(), pool.objectsInUse());
    assertThat(pool.objectsInUse()).isBetween(0, pool.size());

    List<Integer> visited = new ArrayList<>();
    var iterator = pool.iterator();
    while (iterator.hasNext()) {
      visited.add(iterator.index());
      iterator.next();
    }
    assertEquals(expectedIndexes, visited);
  }

  private static int countActive(boolean[] reference) {
    int count = 0;
    for (boolean active : reference) {
      if (active) {
        count++;
      }
    }
    return count;
  }
}

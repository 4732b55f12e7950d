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
package examples;

import org.junit.jupiter.api.Test;
import slotpool.ActiveIterator;
import slotpool.LoggingAllocator;
import slotpool.PoolView;
import slotpool.Reallocator;
import slotpool.Result;
import slotpool.SlotPool;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class ExamplesTest {
  static class Particle {
    float x;
    float y;
    float dx;
    float dy;
    int life;

    Particle launch(float dx, float dy, int life) {
      this.dx = dx;
      this.dy = dy;
      this.life = life;
      return this;
    }

    void reset() {
      x = 0;
      y = 0;
      dx = 0;
      dy = 0;
      life = 0;
    }
  }

  static class Enemy {
    final String kind;
    int health;

    Enemy(String kind, int health) {
      this.kind = kind;
      this.health = health;
    }
  }

  @Test
  void particleTickExample() {
    // tag::particleTickExample[]
    Reallocator<Particle> reallocator = Reallocator.resetting(Particle::new, Particle::reset);
    SlotPool<Particle> particles = SlotPool.builder(reallocator)
        .setCapacity(64)
        .build();

    for (int i = 0; i < 10; i++) {
      Result<Particle> spawned = particles.useNext();
      if (spawned.isSuccess()) {
        spawned.value().launch(i, -i, i + 1);
      }
    }

    int[] expired = new int[particles.size()];
    for (int tick = 0; tick < 10; tick++) {
      int expiredCount = 0;
      for (ActiveIterator<Particle> it = particles.iterator(); !it.isAtEnd(); it.advance()) {
        Particle p = it.current();
        p.x += p.dx;
        p.y += p.dy;
        if (--p.life == 0) {
          expired[expiredCount++] = it.index();
        }
      }
      // Free slots only once the iteration is over.
      for (int i = 0; i < expiredCount; i++) {
        particles.unUse(expired[i]);
      }
    }
    // end::particleTickExample[]

    assertThat(particles.objectsInUse()).isZero();
    assertThat(particles.element(3).life).isZero();
    particles.close();
  }

  @Test
  void enemyWaveExample() {
    // tag::enemyWaveExample[]
    try (SlotPool<Enemy> enemies = SlotPool.of(4, () -> new Enemy("grunt", 10))) {
      Result<Enemy> boss = enemies.useNextReplace(() -> new Enemy("boss", 100));
      int bossIndex = boss.index();

      while (enemies.useNext().isSuccess()) {
        // Fill the remaining slots with grunts.
      }

      int totalHealth = enemies.stream().mapToInt(e -> e.health).sum();
      assertThat(totalHealth).isEqualTo(130);

      enemies.unUse(bossIndex);
      assertThat(enemies.element(bossIndex).kind).isEqualTo("grunt");
    }
    // end::enemyWaveExample[]
  }

  @Test
  void readOnlyViewExample() {
    SlotPool<Enemy> enemies = SlotPool.of(3, () -> new Enemy("grunt", 10));
    enemies.use(1);
    // tag::readOnlyViewExample[]
    PoolView<Enemy> view = enemies;
    int alive = 0;
    for (Enemy enemy : view) {
      if (enemy.health > 0) {
        alive++;
      }
    }
    // end::readOnlyViewExample[]
    assertThat(alive).isEqualTo(1);
  }

  @Test
  void loggingAllocatorExample() {
    // tag::loggingAllocatorExample[]
    class JulLoggingAllocator<T> extends LoggingAllocator<T> {
      private final Logger logger = Logger.getLogger("particles");

      JulLoggingAllocator(Reallocator<T> reallocator) {
        super(reallocator);
      }

      @Override
      protected void logMessage(String message, Throwable throwable) {
        logger.log(Level.WARNING, message, throwable);
      }
    }

    Reallocator<Particle> reallocator = Reallocator.resetting(Particle::new, Particle::reset);
    SlotPool<Particle> particles = SlotPool.of(16, new JulLoggingAllocator<>(reallocator));
    // end::loggingAllocatorExample[]
    assertThat(particles.size()).isEqualTo(16);
  }
}

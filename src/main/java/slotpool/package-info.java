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

/**
 * = Slotpool
 *
 * Slotpool is a fixed-capacity pool of reusable elements, for code that must
 * not allocate in its hot loops.
 *
 * The pools implement the {@link slotpool.SlotPool} interface, and are
 * obtained from {@link slotpool.SlotPool#of(int, slotpool.Allocator)} or
 * through a {@link slotpool.PoolBuilder}. The elements are created by an
 * {@link slotpool.Allocator}, or reset in place by a
 * {@link slotpool.Reallocator}.
 *
 * Pool operations report their failures as a {@link slotpool.Result} rather
 * than by throwing.
 */
package slotpool;

/**
 * In-process publish/subscribe. Each subscription owns a single-thread worker, so delivery is
 * asynchronous and FIFO per topic per subscriber, and a slow or failing handler affects only
 * its own queue.
 */
package com.phillippitts.axiom.service.bus;

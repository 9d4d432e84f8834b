/**
 * Reusable SPI contract tests.
 *
 * <p>Each adapter module extends these abstract classes in its own test sources and supplies
 * the implementation under test.</p>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.testkit.contract;

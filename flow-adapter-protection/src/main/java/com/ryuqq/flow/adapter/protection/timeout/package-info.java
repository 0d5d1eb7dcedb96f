/**
 * Per-call timeout middleware.
 */
package com.ryuqq.flow.adapter.protection.timeout;

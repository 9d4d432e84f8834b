/**
 * 다국어 문단 작성 워크플로우.
 */
package com.ryuqq.agentflow.samples.multilingual;

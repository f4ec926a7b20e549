/**
 * Per-provider request shaping, stream decoding and error classification.
 */
package fr.lapetina.llm.verifier.domain.adapter;

/**
 * Small shared helpers: thread factories and the flat JSON codec used for
 * envelopes and transport headers.
 */
package io.jobqueue.util;

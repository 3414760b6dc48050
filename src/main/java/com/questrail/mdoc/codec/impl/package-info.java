/**
 * Default implementations of the chunking codec interfaces.
 */
package com.questrail.mdoc.codec.impl;

/**
 * Terminal wire model: the message envelope, terminal metadata and service responses,
 * with their JSON codec.
 */
package com.switchboard.protocol;

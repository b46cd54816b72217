/**
 * Pure Java value types shared across all Card Architect modules.
 *
 * <p>Enumerations for card spec generations, asset roles, URI schemes and media kinds.
 * This module has no dependencies.
 */
package com.cardarchitect.types;

/*
 * Copyright 2026 Babak Farhang
 */
/**
 * JDBC backing for zone attestations and anchors.
 * 
 * @see io.crums.zone.sql.SqlZoneSchema
 */
package io.crums.zone.sql;

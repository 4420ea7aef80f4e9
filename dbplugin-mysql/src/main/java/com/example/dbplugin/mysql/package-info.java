/**
 * MySQL backend for the database secrets plugin: default rotation and revocation templates, the
 * classification of MySQL's "not supported in the prepared statement protocol" error and
 * Connector/J specific connection settings.
 */
package com.example.dbplugin.mysql;

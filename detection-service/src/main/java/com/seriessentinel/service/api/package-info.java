/**
 * Wire types of the detection HTTP API. Property names are snake_case.
 */
package com.seriessentinel.service.api;

/**
 * Message model: the two payload variants and endpoint identity. Pure values,
 * free of wire and transport concerns.
 */
package com.questrail.courier.model;

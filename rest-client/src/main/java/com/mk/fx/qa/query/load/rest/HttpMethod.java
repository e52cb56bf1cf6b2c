package com.mk.fx.qa.query.load.rest;

/** Methods the load client issues. Searches are body-less reads. */
public enum HttpMethod {
  GET
}

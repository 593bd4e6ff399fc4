module io.github.cyfko.torm.core {
    requires java.logging;

    exports io.github.cyfko.torm.core;
    exports io.github.cyfko.torm.core.api;
    exports io.github.cyfko.torm.core.config;
    exports io.github.cyfko.torm.core.exception;
    exports io.github.cyfko.torm.core.impl;
    exports io.github.cyfko.torm.core.model;
    exports io.github.cyfko.torm.core.orm;
    exports io.github.cyfko.torm.core.query;
    exports io.github.cyfko.torm.core.spi;
    exports io.github.cyfko.torm.core.utils;
    exports io.github.cyfko.torm.core.validation;
}

package com.starscape.mentana.common.domain;

import com.starscape.mentana.common.exception.DomainError;
import com.starscape.mentana.common.exception.DomainException;
import com.starscape.mentana.common.exception.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void flatMapShortCircuitsOnFailure() {
        Result<Integer> failed = Result.failure(ErrorKind.NOT_FOUND, "missing");

        Result<String> mapped = failed.flatMap(value -> Result.success("never " + value));

        assertTrue(mapped.isFailure());
        assertEquals(ErrorKind.NOT_FOUND, mapped.error().kind());
        assertEquals("missing", mapped.error().message());
    }

    @Test
    void withOperationTagsFailuresOnly() {
        Result<String> ok = Result.success("value");
        Result<String> failed = Result.failure(DomainError.conflict("taken"));

        assertSame(ok, ok.withOperation("createUser"));
        DomainError tagged = failed.withOperation("createUser").error();
        assertEquals("createUser", tagged.operation());
        assertEquals(ErrorKind.CONFLICT, tagged.kind());
        assertEquals("taken", tagged.message());
    }

    @Test
    void orElseThrowRaisesDomainException() {
        Result<String> failed = Result.failure(DomainError.validation("bad input"));

        DomainException ex = assertThrows(DomainException.class, failed::orElseThrow);

        assertEquals(ErrorKind.VALIDATION, ex.getKind());
        assertEquals("bad input", ex.getError().message());
    }

    @Test
    void valueOnFailureIsAProgrammingError() {
        Result<String> failed = Result.failure(ErrorKind.UNAVAILABLE, "down");

        assertThrows(IllegalStateException.class, failed::value);
        assertThrows(IllegalStateException.class, () -> Result.success("x").error());
    }

    @Test
    void mapTransformsSuccess() {
        assertEquals(4, Result.success("four").map(String::length).value());
    }
}

@NamedInterface("api")
package kr.jemi.zseat.seat.api;

import org.springframework.modulith.NamedInterface;

@NamedInterface("api")
package kr.jemi.zseat.booking.api;

import org.springframework.modulith.NamedInterface;

/*
 * Copyright (C) 2015-2018 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.pipedecode.util;

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.*;

public class ApplicationSettingsTest {
	private static final String FULL_NAME = ApplicationSettingsTest.class.getName() + ".setting";
	private static final String SIMPLE_NAME = ApplicationSettingsTest.class.getSimpleName() + ".setting";

	@After
	public void tearDown() {
		System.clearProperty(FULL_NAME);
		System.clearProperty(SIMPLE_NAME);
	}

	@Test
	public void testDefaults() {
		assertEquals("def", ApplicationSettings.getString(ApplicationSettingsTest.class, "setting", "def"));
		assertNull(ApplicationSettings.getString(ApplicationSettingsTest.class, "setting", null));
		assertEquals(10, ApplicationSettings.getInt(ApplicationSettingsTest.class, "setting", 10));
		assertTrue(ApplicationSettings.getBoolean(ApplicationSettingsTest.class, "setting", true));
	}

	@Test
	public void testSimpleName() {
		System.setProperty(SIMPLE_NAME, " 42 ");

		assertEquals(" 42 ", ApplicationSettings.getString(ApplicationSettingsTest.class, "setting", null));
		assertEquals(42, ApplicationSettings.getInt(ApplicationSettingsTest.class, "setting", 10));
	}

	@Test
	public void testFullNameTakesPrecedence() {
		System.setProperty(SIMPLE_NAME, "false");
		System.setProperty(FULL_NAME, "true");

		assertTrue(ApplicationSettings.getBoolean(ApplicationSettingsTest.class, "setting", false));
	}

	@Test(expected = NumberFormatException.class)
	public void testMalformedNumber() {
		System.setProperty(FULL_NAME, "many");
		ApplicationSettings.getInt(ApplicationSettingsTest.class, "setting", 10);
	}
}
